package com.chainguru.common;

/**
 * Lenient number parsing for values scraped from text (e.g. "1,234.56").
 */
public final class NumberParsing {

    private NumberParsing() {
    }

    /**
     * Strips thousands separators and surrounding whitespace, then parses a double.
     * Null, empty or unparsable input yields 0.0.
     */
    public static double cleanNumber(String text) {
        if (text == null) {
            return 0.0;
        }
        String cleaned = text.replace(",", "").strip();
        if (cleaned.isEmpty()) {
            return 0.0;
        }
        try {
            double value = Double.parseDouble(cleaned);
            return Double.isNaN(value) ? 0.0 : value;
        } catch (NumberFormatException e) {
            return 0.0;
        }
    }

    /**
     * True for a non-empty string of ASCII digits only (account-model chain ids such as "1" or "43114").
     */
    public static boolean isDigitsOnly(String text) {
        if (text == null || text.isEmpty()) {
            return false;
        }
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c < '0' || c > '9') {
                return false;
            }
        }
        return true;
    }
}
