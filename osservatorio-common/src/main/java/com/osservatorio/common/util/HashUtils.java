package com.osservatorio.common.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.regex.Pattern;

public final class HashUtils {

    private static final Pattern IPV4 = Pattern.compile("^\\d{1,3}(\\.\\d{1,3}){3}$");

    private HashUtils() {}

    public static String sha256Hex(byte[] data) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(md.digest(data));
        } catch (NoSuchAlgorithmException e) {
            // Every JRE ships SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    public static String sha256Hex(String value) {
        return sha256Hex(value.getBytes(StandardCharsets.UTF_8));
    }

    public static boolean isNetworkAddress(String identifier) {
        return identifier != null && (IPV4.matcher(identifier).matches() || identifier.contains(":"));
    }

    /**
     * Form of an identifier that is safe to log or persist. Network addresses are
     * replaced by a short hash; credential ids are truncated.
     */
    public static String mask(String identifier) {
        if (identifier == null) {
            return "null";
        }
        if (isNetworkAddress(identifier)) {
            return "addr:" + sha256Hex(identifier).substring(0, 12);
        }
        if (identifier.length() <= 8) {
            return identifier;
        }
        return identifier.substring(0, 8) + "...";
    }
}
