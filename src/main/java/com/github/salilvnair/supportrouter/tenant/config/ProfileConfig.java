package com.github.salilvnair.supportrouter.tenant.config;

import lombok.Getter;
import lombok.Setter;

@Getter
@Setter
public class ProfileConfig {
    private String companyName;
    private String phone;
    private String emergencyPhone;
    private String email;
    private String website;
    private String locations;
    private String businessHours = "måndag-fredag 08:00-16:00";
    private String responseTime = "inom 24 timmar";
    private String services;
    private String pricing;
    private String bookingLink;
    private String toneStyle = "vänlig och professionell";
}
