package com.github.salilvnair.supportrouter.knowledge;

import com.github.salilvnair.supportrouter.engine.exception.SupportRouterErrorCode;
import com.github.salilvnair.supportrouter.engine.exception.TenantConfigurationException;
import com.github.salilvnair.supportrouter.tenant.TenantProfile;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static com.github.salilvnair.supportrouter.support.TestConstants.COMPANY_NAME;
import static com.github.salilvnair.supportrouter.support.TestConstants.EMAIL;
import static com.github.salilvnair.supportrouter.support.TestConstants.PHONE;
import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class PlaceholderResolverTest {

    @Test
    void resolvesProfileValues() {
        PlaceholderResolver resolver = new PlaceholderResolver(profile(COMPANY_NAME));

        assertEquals("Ring " + PHONE + " eller mejla " + EMAIL, resolver.resolve("Ring {phone} eller mejla {email}"));
    }

    @Test
    void substitutedValuesAreNotScannedAgain() {
        PlaceholderResolver resolver = new PlaceholderResolver(profile("{phone} $1 \\AB"));

        assertEquals("Välkommen till {phone} $1 \\AB", resolver.resolve("Välkommen till {company_name}"));
    }

    @Test
    void emergencyPhoneFallsBackToMainPhone() {
        PlaceholderResolver resolver = new PlaceholderResolver(profile(COMPANY_NAME));

        assertEquals(PHONE, resolver.resolve("{emergency_phone}"));
    }

    @Test
    void unknownPlaceholderIsRejected() {
        PlaceholderResolver resolver = new PlaceholderResolver(profile(COMPANY_NAME));

        TenantConfigurationException e = assertThrows(TenantConfigurationException.class,
                () -> resolver.validate("Faxa {fax}", "test"));

        assertEquals(SupportRouterErrorCode.UNKNOWN_PLACEHOLDER, e.getCode());
    }

    @Test
    void emptyProfileValueIsRejected() {
        PlaceholderResolver resolver = new PlaceholderResolver(profile(COMPANY_NAME));

        TenantConfigurationException e = assertThrows(TenantConfigurationException.class,
                () -> resolver.validate("Se {pricing}", "test"));

        assertEquals(SupportRouterErrorCode.TENANT_CONFIG_INVALID, e.getCode());
        assertDoesNotThrow(() -> resolver.validate("Ring {phone}", "test"));
    }

    @Test
    void placeholdersInListsNamesInOrder() {
        assertEquals(Set.of("phone", "email"), PlaceholderResolver.placeholdersIn("{phone} {email} {phone}"));
        assertEquals(Set.of(), PlaceholderResolver.placeholdersIn("{Phone} { phone}"));
    }

    private TenantProfile profile(String companyName) {
        return TenantProfile.builder()
                .companyName(companyName)
                .phone(PHONE)
                .email(EMAIL)
                .build();
    }
}
