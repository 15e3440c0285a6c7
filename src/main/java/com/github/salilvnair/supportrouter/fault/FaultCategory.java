package com.github.salilvnair.supportrouter.fault;

import java.util.Locale;

/**
 * What kind of property fault a report describes. Declaration order breaks ties when a report
 * mentions several kinds equally often.
 */
public enum FaultCategory {
    WATER,
    ELECTRICAL,
    HEATING,
    SECURITY,
    STRUCTURAL,
    APPLIANCE,
    OTHER;

    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
