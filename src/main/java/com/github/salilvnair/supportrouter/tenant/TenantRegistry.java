package com.github.salilvnair.supportrouter.tenant;

import com.github.salilvnair.supportrouter.engine.exception.TenantNotFoundException;
import com.github.salilvnair.supportrouter.tenant.config.TenantConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Owns the compiled runtime of every tenant that has been used.
 * <p>
 * Runtimes are immutable. {@link #reload(String)} compiles a fresh runtime and swaps it in with a
 * single map write; requests already holding the old runtime finish against it.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TenantRegistry {

    private final TenantConfigSource configSource;
    private final TenantConfigCompiler compiler;

    private final Map<String, TenantRuntime> runtimes = new ConcurrentHashMap<>();

    /**
     * @throws TenantNotFoundException when the source does not know the tenant
     */
    public TenantRuntime getOrCreate(String tenantId) {
        TenantRuntime cached = runtimes.get(tenantId);
        if (cached != null) {
            return cached;
        }
        return runtimes.computeIfAbsent(tenantId, this::load);
    }

    public Optional<TenantRuntime> find(String tenantId) {
        return Optional.ofNullable(runtimes.get(tenantId));
    }

    /** Drops the cached runtime; the next request loads it again. */
    public void invalidate(String tenantId) {
        if (runtimes.remove(tenantId) != null) {
            log.info("Invalidated tenant runtime tenant={}", tenantId);
        }
    }

    /**
     * Compiles the tenant from its source and replaces the cached runtime. If compilation fails
     * the previous runtime stays in place.
     */
    public TenantRuntime reload(String tenantId) {
        TenantRuntime fresh = load(tenantId);
        runtimes.put(tenantId, fresh);
        log.info("Reloaded tenant runtime tenant={} rules={} knowledgeEntries={}",
                tenantId, fresh.escalationRules().size(), fresh.catalog().entries().size());
        return fresh;
    }

    /** Compiles and installs a configuration supplied directly by the caller. */
    public TenantRuntime register(TenantConfig config) {
        TenantRuntime fresh = compiler.compile(config);
        runtimes.put(fresh.tenantId(), fresh);
        return fresh;
    }

    public Set<String> loadedTenants() {
        return Set.copyOf(runtimes.keySet());
    }

    private TenantRuntime load(String tenantId) {
        TenantConfig config = configSource.load(tenantId)
                .orElseThrow(() -> new TenantNotFoundException(tenantId));
        if (config.getTenantId() == null) {
            config.setTenantId(tenantId);
        }
        return compiler.compile(config);
    }
}
