package com.flagship.transfer_engine.audit;

import lombok.Value;

/**
 * Where a call came from, attached to every audit record it produces.
 */
@Value
public class RequestMetadata {

    public static final RequestMetadata NONE = new RequestMetadata(null, null);

    String originAddress;
    String clientInfo;

    public static RequestMetadata of(String originAddress, String clientInfo) {
        return new RequestMetadata(originAddress, clientInfo);
    }
}
