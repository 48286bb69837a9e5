package com.flagship.transfer_engine.common;

import com.flagship.transfer_engine.audit.RequestMetadata;
import jakarta.servlet.http.HttpServletRequest;

/**
 * Extracts the origin address and client string attached to audit records.
 *
 * Origin address precedence: first X-Forwarded-For entry, X-Real-IP, then the socket address.
 */
public final class RequestMetadataResolver {

    private static final int MAX_ADDRESS_LENGTH = 64;

    private RequestMetadataResolver() {
    }

    public static RequestMetadata resolve(HttpServletRequest request) {
        return RequestMetadata.of(originAddress(request), request.getHeader("User-Agent"));
    }

    static String originAddress(HttpServletRequest request) {
        String forwarded = request.getHeader("X-Forwarded-For");
        if (forwarded != null && !forwarded.isBlank()) {
            return truncate(forwarded.split(",")[0].trim());
        }
        String realIp = request.getHeader("X-Real-IP");
        if (realIp != null && !realIp.isBlank()) {
            return truncate(realIp.trim());
        }
        return truncate(request.getRemoteAddr());
    }

    private static String truncate(String address) {
        if (address == null) {
            return null;
        }
        return address.length() > MAX_ADDRESS_LENGTH ? address.substring(0, MAX_ADDRESS_LENGTH) : address;
    }
}
