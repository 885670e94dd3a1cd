package com.conveyal.stopboard.util;

/**
 * The methods and classes in this package should eventually be part of a shared Conveyal library.
 */
public abstract class Util {

    public static String human (long n) {
        if (n >= 1000000000) return String.format("%.1fG", n/1000000000.0);
        if (n >= 1000000) return String.format("%.1fM", n/1000000.0);
        if (n >= 1000) return String.format("%dk", n/1000);
        else return String.format("%d", n);
    }

    /**
     * City identifiers end up in file names, so only allow a conservative character set.
     */
    public static void ensureValidCityId (String city) {
        if (city == null || !city.matches("^[a-zA-Z0-9_\\-]+$")) {
            throw new IllegalStateException("City id must only have alphanumeric characters, hyphens or underscores");
        }
    }

}
