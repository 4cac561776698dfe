package com.techStack.geoVault.models.policy;

import com.techStack.geoVault.util.FirestoreUtil;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * The single active access policy: a geofence circle, an allowed network
 * identifier and a daily time window in {@code HH:mm} (which may wrap midnight).
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class AccessPolicy {

    private double latitude;
    private double longitude;
    private double radiusMeters;
    private String allowedNetwork;
    private String startTime;
    private String endTime;

    private Instant updatedAt;
    private String updatedBy;

    public Map<String, Object> toMap() {
        Map<String, Object> map = new HashMap<>();
        map.put("latitude", latitude);
        map.put("longitude", longitude);
        map.put("radiusMeters", radiusMeters);
        map.put("allowedNetwork", allowedNetwork);
        map.put("startTime", startTime);
        map.put("endTime", endTime);
        map.put("updatedAt", FirestoreUtil.toTimestamp(updatedAt));
        map.put("updatedBy", updatedBy);
        return map;
    }

    public static AccessPolicy fromMap(Map<String, Object> map) {
        Double lat = FirestoreUtil.toDouble(map.get("latitude"));
        Double lon = FirestoreUtil.toDouble(map.get("longitude"));
        Double radius = FirestoreUtil.toDouble(map.get("radiusMeters"));
        return AccessPolicy.builder()
                .latitude(lat != null ? lat : 0)
                .longitude(lon != null ? lon : 0)
                .radiusMeters(radius != null ? radius : 0)
                .allowedNetwork((String) map.get("allowedNetwork"))
                .startTime((String) map.get("startTime"))
                .endTime((String) map.get("endTime"))
                .updatedAt(FirestoreUtil.toInstant(map.get("updatedAt")))
                .updatedBy((String) map.get("updatedBy"))
                .build();
    }
}
