package com.techStack.geoVault.models.audit;

import com.techStack.geoVault.util.FirestoreUtil;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuthEventLog {

    private String id;
    private String username;
    private AuthEventType eventType;
    private String reason;
    private String ipAddress;
    private Instant timestamp;

    public Map<String, Object> toMap() {
        Map<String, Object> map = new HashMap<>();
        map.put("id", id);
        map.put("username", username);
        map.put("eventType", eventType != null ? eventType.name() : null);
        map.put("reason", reason);
        map.put("ipAddress", ipAddress);
        map.put("timestamp", FirestoreUtil.toTimestamp(timestamp));
        return map;
    }
}
