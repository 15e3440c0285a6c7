package com.github.salilvnair.supportrouter.tenant;

/**
 * Reply templates a tenant may override, with the built-in Swedish defaults.
 */
public enum ResponseTemplateKey {
    GREETING("Hej och välkommen till {company_name}! Hur kan vi hjälpa dig i dag?"),
    GRATITUDE("Varsågod! Hör av dig om det är något mer du undrar över."),
    GOODBYE("Tack för att du hörde av dig till {company_name}. Ha en fin dag!"),
    CONTACT("Du når oss på telefon {phone} eller via e-post {email}. Vi svarar normalt {response_time}."),
    HOURS("Våra öppettider är {business_hours}. Vid akuta fel utanför kontorstid, ring {emergency_phone}."),
    HOW_TO_REPORT("Du gör en felanmälan genom att beskriva felet här i chatten eller mejla {email}. "
            + "Ange adress och lägenhetsnummer. Vid akuta fel, ring {emergency_phone}."),
    FIRE_GAS("Vid brand eller gaslukt: lämna lägenheten och ring 112 omedelbart. "
            + "Kontakta sedan vår jour på {emergency_phone}."),
    WATER_LEAK("Det låter akut! Stäng av vattnet om du kan och ring vår jour direkt på {emergency_phone}. "
            + "Lägg gärna ut handdukar för att begränsa skadan."),
    LOCKOUT("Är du utelåst? Ring vår jour på {emergency_phone} så hjälper vi dig in. Ha legitimation redo."),
    POWER_FAILURE("Kontrollera först säkringarna i elcentralen. Är hela fastigheten strömlös, "
            + "ring vår jour på {emergency_phone}."),
    FALLBACK("Det kan jag tyvärr inte svara på just nu. Kontakta oss på {phone} eller {email} "
            + "så hjälper vi dig vidare."),
    ESCALATION("Jag kopplar ditt ärende vidare till vår personal, som återkommer så snart som möjligt. "
            + "Du kan också ringa oss på {phone}."),
    ESCALATED_SESSION("Ditt ärende är redan överlämnat till vår personal och de återkommer till dig. "
            + "Vid akuta ärenden, ring {emergency_phone}.");

    private final String defaultTemplate;

    ResponseTemplateKey(String defaultTemplate) {
        this.defaultTemplate = defaultTemplate;
    }

    public String defaultTemplate() {
        return defaultTemplate;
    }
}
