package com.techStack.geoVault.models.wfh;

import com.techStack.geoVault.models.policy.PolicyOverride;
import com.techStack.geoVault.util.FirestoreUtil;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Work-from-home request and, once approved, the exception window granted by an admin.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class WfhGrant {

    private String id;
    private String username;
    private WfhStatus status;
    private String reason;
    private Instant requestedAt;

    private Instant accessStart;
    private Instant accessEnd;
    private String adminComment;
    private Instant decidedAt;
    private String decidedBy;

    public boolean isApproved() {
        return status == WfhStatus.APPROVED;
    }

    public boolean hasWindow() {
        return accessStart != null && accessEnd != null;
    }

    public boolean isWindowActive(Instant now) {
        return isApproved() && hasWindow() && !now.isBefore(accessStart) && !now.isAfter(accessEnd);
    }

    public PolicyOverride toOverride() {
        if (!isApproved() || !hasWindow()) {
            return PolicyOverride.NONE;
        }
        return new PolicyOverride(true, accessStart, accessEnd, id);
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new HashMap<>();
        map.put("id", id);
        map.put("username", username);
        map.put("status", status != null ? status.name() : null);
        map.put("reason", reason);
        map.put("requestedAt", FirestoreUtil.toTimestamp(requestedAt));
        map.put("accessStart", FirestoreUtil.toTimestamp(accessStart));
        map.put("accessEnd", FirestoreUtil.toTimestamp(accessEnd));
        map.put("adminComment", adminComment);
        map.put("decidedAt", FirestoreUtil.toTimestamp(decidedAt));
        map.put("decidedBy", decidedBy);
        return map;
    }

    public static WfhGrant fromMap(Map<String, Object> map) {
        String status = (String) map.get("status");
        return WfhGrant.builder()
                .id((String) map.get("id"))
                .username((String) map.get("username"))
                .status(status != null ? WfhStatus.valueOf(status) : WfhStatus.PENDING)
                .reason((String) map.get("reason"))
                .requestedAt(FirestoreUtil.toInstant(map.get("requestedAt")))
                .accessStart(FirestoreUtil.toInstant(map.get("accessStart")))
                .accessEnd(FirestoreUtil.toInstant(map.get("accessEnd")))
                .adminComment((String) map.get("adminComment"))
                .decidedAt(FirestoreUtil.toInstant(map.get("decidedAt")))
                .decidedBy((String) map.get("decidedBy"))
                .build();
    }
}
