package com.github.salilvnair.supportrouter.guard;

public record GuardVerdict(boolean flagged, String reason) {

    private static final GuardVerdict CLEAN = new GuardVerdict(false, null);

    public static GuardVerdict clean() {
        return CLEAN;
    }

    public static GuardVerdict flagged(String reason) {
        return new GuardVerdict(true, reason);
    }
}
