package com.techStack.geoVault.controller.wfh;

import com.techStack.geoVault.dto.request.WfhCreateRequest;
import com.techStack.geoVault.dto.response.ApiResponse;
import com.techStack.geoVault.dto.response.WfhGrantResponse;
import com.techStack.geoVault.models.auth.AuthenticatedUser;
import com.techStack.geoVault.service.wfh.WfhGrantService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.time.Clock;

/**
 * Employee side of work-from-home requests.
 */
@RestController
@RequestMapping("/api/wfh-request")
@RequiredArgsConstructor
public class WfhController {

    private final WfhGrantService wfhGrantService;
    private final Clock clock;

    @PostMapping
    public Mono<ResponseEntity<ApiResponse<WfhGrantResponse>>> submit(
            @Valid @RequestBody WfhCreateRequest request,
            @AuthenticationPrincipal AuthenticatedUser user) {

        return wfhGrantService.submit(user.username(), request.getReason())
                .map(grant -> ResponseEntity.status(HttpStatus.CREATED)
                        .body(ApiResponse.success("WFH request submitted",
                                WfhGrantResponse.from(grant, clock.instant()))));
    }

    @GetMapping("/status")
    public Mono<ResponseEntity<ApiResponse<WfhGrantResponse>>> status(
            @AuthenticationPrincipal AuthenticatedUser user) {

        return wfhGrantService.latestFor(user.username())
                .map(grant -> ResponseEntity.ok(ApiResponse.success(WfhGrantResponse.from(grant, clock.instant()))));
    }
}
