package com.techStack.geoVault.dto.request;

import com.techStack.geoVault.models.wfh.WfhStatus;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Approve or reject the pending request of a user. The access window is ISO-8601 and optional;
 * without one an approval grants no bypass until a window is allocated.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WfhDecisionRequest {

    @NotNull(message = "Status is required")
    private WfhStatus status;

    private String accessStart;

    private String accessEnd;

    @Size(max = 1000, message = "Comment must be at most 1000 characters")
    private String adminComment;
}
