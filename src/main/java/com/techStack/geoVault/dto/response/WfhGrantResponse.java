package com.techStack.geoVault.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.techStack.geoVault.models.wfh.WfhGrant;
import lombok.Builder;

import java.time.Instant;

@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WfhGrantResponse(
        String id,
        String username,
        String status,
        String reason,
        Instant requestedAt,
        Instant accessStart,
        Instant accessEnd,
        String adminComment,
        Instant decidedAt,
        String decidedBy,
        boolean windowActive
) {

    public static WfhGrantResponse from(WfhGrant grant, Instant now) {
        return WfhGrantResponse.builder()
                .id(grant.getId())
                .username(grant.getUsername())
                .status(grant.getStatus().name())
                .reason(grant.getReason())
                .requestedAt(grant.getRequestedAt())
                .accessStart(grant.getAccessStart())
                .accessEnd(grant.getAccessEnd())
                .adminComment(grant.getAdminComment())
                .decidedAt(grant.getDecidedAt())
                .decidedBy(grant.getDecidedBy())
                .windowActive(grant.isWindowActive(now))
                .build();
    }
}
