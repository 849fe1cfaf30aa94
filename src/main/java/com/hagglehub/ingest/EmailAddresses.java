package com.hagglehub.ingest;

import java.util.regex.Pattern;

/**
 * Lenient helpers for header-style address strings such as
 * {@code "Sales Team" <sales@dealer.com>, other@x.com}.
 */
public final class EmailAddresses {

    private static final Pattern ANGLE_ADDRESS = Pattern.compile("<([^<>]*)>");

    private EmailAddresses() {}

    /** First bare address in a header value, or the trimmed input when no address form is found. */
    public static String firstAddress(String header) {
        if (header == null) return "";
        var value = header.trim();
        if (value.isEmpty()) return "";
        var angle = ANGLE_ADDRESS.matcher(value);
        if (angle.find()) {
            return angle.group(1).trim();
        }
        var comma = value.indexOf(',');
        if (comma >= 0) value = value.substring(0, comma);
        return value.trim();
    }

    /** Text before the last '@', or empty when the address has none. */
    public static String localPart(String address) {
        var addr = firstAddress(address);
        int at = addr.lastIndexOf('@');
        return at < 0 ? "" : addr.substring(0, at).trim();
    }

    /** Lower-cased text after the last '@', or empty when the address has none. */
    public static String domain(String address) {
        var addr = firstAddress(address);
        int at = addr.lastIndexOf('@');
        return at < 0 ? "" : addr.substring(at + 1).trim().toLowerCase();
    }
}
