package com.techStack.geoVault.models.audit;

import com.techStack.geoVault.util.FirestoreUtil;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Append-only record of a file operation and the decision taken for it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AccessDecisionLog {

    private String id;
    private String username;
    private String fileId;
    private String filename;
    private AccessAction action;
    private Instant timestamp;
    private boolean success;
    private String reason;
    private Double latitude;
    private Double longitude;
    private String network;
    private String wfhGrantId;

    public Map<String, Object> toMap() {
        Map<String, Object> map = new HashMap<>();
        map.put("id", id);
        map.put("username", username);
        map.put("fileId", fileId);
        map.put("filename", filename);
        map.put("action", action != null ? action.name() : null);
        map.put("timestamp", FirestoreUtil.toTimestamp(timestamp));
        map.put("success", success);
        map.put("reason", reason);
        map.put("latitude", latitude);
        map.put("longitude", longitude);
        map.put("network", network);
        map.put("wfhGrantId", wfhGrantId);
        return map;
    }

    public static AccessDecisionLog fromMap(Map<String, Object> map) {
        String action = (String) map.get("action");
        return AccessDecisionLog.builder()
                .id((String) map.get("id"))
                .username((String) map.get("username"))
                .fileId((String) map.get("fileId"))
                .filename((String) map.get("filename"))
                .action(action != null ? AccessAction.valueOf(action) : null)
                .timestamp(FirestoreUtil.toInstant(map.get("timestamp")))
                .success(Boolean.TRUE.equals(map.get("success")))
                .reason((String) map.get("reason"))
                .latitude(FirestoreUtil.toDouble(map.get("latitude")))
                .longitude(FirestoreUtil.toDouble(map.get("longitude")))
                .network((String) map.get("network"))
                .wfhGrantId((String) map.get("wfhGrantId"))
                .build();
    }
}
