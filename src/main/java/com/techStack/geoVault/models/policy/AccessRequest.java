package com.techStack.geoVault.models.policy;

/**
 * Client-reported context of an access attempt. Every field may be absent.
 */
public record AccessRequest(Double latitude, Double longitude, String network) {

    public static final AccessRequest EMPTY = new AccessRequest(null, null, null);

    public boolean hasLocation() {
        return latitude != null && longitude != null;
    }

    public boolean hasNetwork() {
        return network != null && !network.isBlank();
    }

    public static AccessRequest orEmpty(AccessRequest request) {
        return request != null ? request : EMPTY;
    }
}
