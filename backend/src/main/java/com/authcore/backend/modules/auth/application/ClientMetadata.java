package com.authcore.backend.modules.auth.application;

/**
 * Optional device and network details stored next to an issued refresh token.
 */
public record ClientMetadata(String deviceInfo, String ipAddress) {

    private static final int DEVICE_INFO_MAX_LENGTH = 255;
    private static final int IP_ADDRESS_MAX_LENGTH = 64;

    public ClientMetadata {
        deviceInfo = normalize(deviceInfo, DEVICE_INFO_MAX_LENGTH);
        ipAddress = normalize(ipAddress, IP_ADDRESS_MAX_LENGTH);
    }

    public static ClientMetadata none() {
        return new ClientMetadata(null, null);
    }

    private static String normalize(String raw, int maxLength) {
        if (raw == null) {
            return null;
        }
        String trimmed = raw.trim();
        if (trimmed.isEmpty()) {
            return null;
        }
        if (trimmed.length() > maxLength) {
            return trimmed.substring(0, maxLength);
        }
        return trimmed;
    }
}
