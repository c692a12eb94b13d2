package com.levstrat.util;

import java.util.Locale;

/**
 * Simple validators/normalizers for EVM addresses.
 * The all-zero address stands for "no token" / "not set" throughout the engine.
 */
public final class AddressUtil {
    private AddressUtil(){}

    public static final String ZERO = "0x0000000000000000000000000000000000000000";

    public static String normalize(String addr) {
        if (addr == null) throw new IllegalArgumentException("address is null");
        if (!addr.startsWith("0x")) throw new IllegalArgumentException("address must start with 0x: " + addr);
        String hex = addr.substring(2);
        if (hex.length() != 40) throw new IllegalArgumentException("invalid address length (need 40 hex chars): " + addr);
        for (int i = 0; i < hex.length(); i++) {
            if (Character.digit(hex.charAt(i), 16) < 0) {
                throw new IllegalArgumentException("invalid hex character in address: " + addr);
            }
        }
        return "0x" + hex.toLowerCase(Locale.ROOT);
    }

    /** Normalizes, mapping null/blank to {@link #ZERO}. */
    public static String normalizeOrZero(String addr) {
        if (addr == null || addr.isBlank()) return ZERO;
        return normalize(addr);
    }

    /** True for null, blank or the zero address. */
    public static boolean isZero(String addr) {
        if (addr == null || addr.isBlank()) return true;
        return ZERO.equalsIgnoreCase(addr);
    }

    public static boolean same(String a, String b) {
        if (isZero(a) || isZero(b)) return false;
        return a.equalsIgnoreCase(b);
    }
}
