package io.github.manjago.netscript.host;

/**
 * RAM arithmetic. All reservations are rounded to two decimals so repeated
 * reserve/release pairs never drift.
 */
public final class RamMath {

    private RamMath() {
        // Utility class
    }

    public static double roundToTwo(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
