package com.flagship.transfer_engine.security;

import lombok.Value;

import java.util.UUID;

/**
 * Authenticated operator resolved by the upstream identity provider.
 */
@Value
public class Principal {

    public static final String ID_HEADER = "X-Principal-Id";
    public static final String ROLE_HEADER = "X-Principal-Role";

    UUID id;
    Role role;

    /**
     * Builds a principal from the trusted gateway headers.
     *
     * @throws AuthenticationRequiredException if the id header is missing or not a UUID
     */
    public static Principal fromHeaders(String idHeader, String roleHeader) {
        if (idHeader == null || idHeader.isBlank()) {
            throw new AuthenticationRequiredException("Missing principal header " + ID_HEADER);
        }
        UUID id;
        try {
            id = UUID.fromString(idHeader.trim());
        } catch (IllegalArgumentException e) {
            throw new AuthenticationRequiredException("Malformed principal id: " + idHeader);
        }
        return new Principal(id, Role.fromName(roleHeader));
    }
}
