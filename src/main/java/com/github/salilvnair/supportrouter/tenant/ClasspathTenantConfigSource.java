package com.github.salilvnair.supportrouter.tenant;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.salilvnair.supportrouter.config.SupportRouterProperties;
import com.github.salilvnair.supportrouter.engine.exception.SupportRouterErrorCode;
import com.github.salilvnair.supportrouter.engine.exception.TenantConfigurationException;
import com.github.salilvnair.supportrouter.tenant.config.TenantConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;

import java.io.IOException;
import java.io.InputStream;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Reads {@code <location><tenantId>.json} from the classpath. Unknown JSON properties fail the load.
 * Registered unless the application supplies its own {@link TenantConfigSource}.
 */
@Slf4j
public class ClasspathTenantConfigSource implements TenantConfigSource {

    private static final Pattern TENANT_ID = Pattern.compile("[A-Za-z0-9_-]{1,64}");

    private final ObjectMapper mapper = new ObjectMapper()
            .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    private final String location;

    public ClasspathTenantConfigSource(SupportRouterProperties properties) {
        String configured = properties.getTenants().getLocation();
        this.location = configured.endsWith("/") ? configured : configured + "/";
    }

    @Override
    public Optional<TenantConfig> load(String tenantId) {
        if (tenantId == null || !TENANT_ID.matcher(tenantId).matches()) {
            return Optional.empty();
        }
        ClassPathResource resource = new ClassPathResource(location + tenantId + ".json");
        if (!resource.exists()) {
            return Optional.empty();
        }
        try (InputStream in = resource.getInputStream()) {
            TenantConfig config = mapper.readValue(in, TenantConfig.class);
            if (config.getTenantId() == null) {
                config.setTenantId(tenantId);
            }
            else if (!config.getTenantId().equals(tenantId)) {
                throw new TenantConfigurationException(
                        SupportRouterErrorCode.TENANT_CONFIG_INVALID,
                        resource.getPath() + " declares tenantId " + config.getTenantId()
                );
            }
            log.info("Loaded tenant configuration tenant={} resource={}", tenantId, resource.getPath());
            return Optional.of(config);
        }
        catch (IOException e) {
            throw new TenantConfigurationException(
                    SupportRouterErrorCode.TENANT_CONFIG_UNREADABLE,
                    "Could not read tenant configuration " + resource.getPath() + ": " + e.getMessage(),
                    e
            );
        }
    }
}
