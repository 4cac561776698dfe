package com.techStack.geoVault.service.wfh;

import com.techStack.geoVault.dto.request.WfhDecisionRequest;
import com.techStack.geoVault.exception.resource.ConflictException;
import com.techStack.geoVault.exception.resource.ResourceNotFoundException;
import com.techStack.geoVault.exception.validation.ValidationException;
import com.techStack.geoVault.models.wfh.WfhStatus;
import com.techStack.geoVault.support.InMemoryWfhGrantRepository;
import com.techStack.geoVault.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.*;

class WfhGrantServiceTest {

    private MutableClock clock;
    private WfhGrantService wfhGrantService;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-02T10:00:00Z"));
        wfhGrantService = new WfhGrantService(new InMemoryWfhGrantRepository(), clock);
    }

    private static WfhDecisionRequest approve(String start, String end) {
        return new WfhDecisionRequest(WfhStatus.APPROVED, start, end, "ok");
    }

    @Test
    void submit_shouldCreatePendingRequest() {
        StepVerifier.create(wfhGrantService.submit("alice", "  plumber visit "))
                .assertNext(grant -> {
                    assertThat(grant.getStatus()).isEqualTo(WfhStatus.PENDING);
                    assertThat(grant.getReason()).isEqualTo("plumber visit");
                    assertThat(grant.getRequestedAt()).isEqualTo(clock.instant());
                })
                .verifyComplete();
    }

    @Test
    void submit_shouldConflict_whenPendingRequestExists() {
        wfhGrantService.submit("alice", "first").block();

        StepVerifier.create(wfhGrantService.submit("alice", "second"))
                .expectError(ConflictException.class)
                .verify();
    }

    @Test
    void submit_shouldRequireReason() {
        StepVerifier.create(wfhGrantService.submit("alice", " "))
                .expectError(ValidationException.class)
                .verify();
    }

    @Test
    void decide_shouldApproveWithWindow_andExposeActiveGrant() {
        wfhGrantService.submit("alice", "sick child").block();

        StepVerifier.create(wfhGrantService.decide("alice",
                        approve("2026-03-02T09:00:00Z", "2026-03-02T18:00:00Z"), "admin"))
                .assertNext(grant -> {
                    assertThat(grant.getStatus()).isEqualTo(WfhStatus.APPROVED);
                    assertThat(grant.getDecidedBy()).isEqualTo("admin");
                    assertThat(grant.isWindowActive(clock.instant())).isTrue();
                })
                .verifyComplete();

        StepVerifier.create(wfhGrantService.findActiveGrant("alice"))
                .expectNextCount(1)
                .verifyComplete();
    }

    @Test
    void findActiveGrant_shouldBeEmpty_outsideWindow() {
        wfhGrantService.submit("alice", "sick child").block();
        wfhGrantService.decide("alice", approve("2026-03-02T09:00:00Z", "2026-03-02T18:00:00Z"), "admin").block();

        clock.advance(Duration.ofHours(9));

        StepVerifier.create(wfhGrantService.findActiveGrant("alice")).verifyComplete();
    }

    @Test
    void decide_shouldReadTimestampWithoutOffsetAsUtc() {
        wfhGrantService.submit("alice", "sick child").block();

        StepVerifier.create(wfhGrantService.decide("alice", approve("2026-03-02T09:00", "2026-03-02T11:00"), "admin"))
                .assertNext(grant -> assertThat(grant.getAccessStart()).isEqualTo(Instant.parse("2026-03-02T09:00:00Z")))
                .verifyComplete();
    }

    @Test
    void decide_shouldRejectInvertedOrPartialWindow() {
        wfhGrantService.submit("alice", "sick child").block();

        StepVerifier.create(wfhGrantService.decide("alice",
                        approve("2026-03-02T18:00:00Z", "2026-03-02T09:00:00Z"), "admin"))
                .expectError(ValidationException.class)
                .verify();
        StepVerifier.create(wfhGrantService.decide("alice", approve("2026-03-02T18:00:00Z", null), "admin"))
                .expectError(ValidationException.class)
                .verify();
    }

    @Test
    void decide_shouldRejectPendingAsTargetStatus() {
        StepVerifier.create(wfhGrantService.decide("alice",
                        new WfhDecisionRequest(WfhStatus.PENDING, null, null, null), "admin"))
                .expectError(ValidationException.class)
                .verify();
    }

    @Test
    void decide_shouldFail_whenNoPendingRequest() {
        StepVerifier.create(wfhGrantService.decide("alice", approve(null, null), "admin"))
                .expectError(ResourceNotFoundException.class)
                .verify();
    }

    @Test
    void findActiveGrant_shouldIgnoreApprovalWithoutWindow() {
        wfhGrantService.submit("alice", "sick child").block();
        wfhGrantService.decide("alice", approve(null, null), "admin").block();

        StepVerifier.create(wfhGrantService.findActiveGrant("alice")).verifyComplete();
    }

    @Test
    void latestFor_shouldReturnNewestRequest() {
        wfhGrantService.submit("alice", "first").block();
        wfhGrantService.decide("alice", new WfhDecisionRequest(WfhStatus.REJECTED, null, null, "no"), "admin").block();
        clock.advance(Duration.ofMinutes(5));
        wfhGrantService.submit("alice", "second").block();

        StepVerifier.create(wfhGrantService.latestFor("alice"))
                .assertNext(grant -> assertThat(grant.getReason()).isEqualTo("second"))
                .verifyComplete();
        StepVerifier.create(wfhGrantService.latestFor("bob"))
                .expectError(ResourceNotFoundException.class)
                .verify();
    }
}
