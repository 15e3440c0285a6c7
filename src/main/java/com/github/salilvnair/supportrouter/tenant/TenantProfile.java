package com.github.salilvnair.supportrouter.tenant;

import lombok.Builder;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Typed tenant profile. Each field is exposed to templates under a fixed placeholder name.
 */
@Builder
public record TenantProfile(
        String companyName,
        String phone,
        String emergencyPhone,
        String email,
        String website,
        String locations,
        String businessHours,
        String responseTime,
        String services,
        String pricing,
        String bookingLink,
        String toneStyle
) {

    public static final String COMPANY_NAME = "company_name";
    public static final String PHONE = "phone";
    public static final String EMERGENCY_PHONE = "emergency_phone";
    public static final String EMAIL = "email";
    public static final String WEBSITE = "website";
    public static final String LOCATIONS = "locations";
    public static final String BUSINESS_HOURS = "business_hours";
    public static final String RESPONSE_TIME = "response_time";
    public static final String SERVICES = "services";
    public static final String PRICING = "pricing";
    public static final String BOOKING_LINK = "booking_link";

    /** Placeholder name to value. Blank values are included as empty strings. */
    public Map<String, String> placeholders() {
        Map<String, String> values = new LinkedHashMap<>();
        values.put(COMPANY_NAME, nullToEmpty(companyName));
        values.put(PHONE, nullToEmpty(phone));
        values.put(EMERGENCY_PHONE, isBlank(emergencyPhone) ? nullToEmpty(phone) : emergencyPhone);
        values.put(EMAIL, nullToEmpty(email));
        values.put(WEBSITE, nullToEmpty(website));
        values.put(LOCATIONS, nullToEmpty(locations));
        values.put(BUSINESS_HOURS, nullToEmpty(businessHours));
        values.put(RESPONSE_TIME, nullToEmpty(responseTime));
        values.put(SERVICES, nullToEmpty(services));
        values.put(PRICING, nullToEmpty(pricing));
        values.put(BOOKING_LINK, nullToEmpty(bookingLink));
        return values;
    }

    public String effectiveEmergencyPhone() {
        return isBlank(emergencyPhone) ? phone : emergencyPhone;
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value.trim();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
