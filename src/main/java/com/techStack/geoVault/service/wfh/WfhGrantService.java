package com.techStack.geoVault.service.wfh;

import com.techStack.geoVault.dto.request.WfhDecisionRequest;
import com.techStack.geoVault.exception.resource.ConflictException;
import com.techStack.geoVault.exception.resource.ResourceNotFoundException;
import com.techStack.geoVault.exception.validation.ValidationException;
import com.techStack.geoVault.models.wfh.WfhGrant;
import com.techStack.geoVault.models.wfh.WfhStatus;
import com.techStack.geoVault.repository.wfh.WfhGrantRepository;
import com.techStack.geoVault.util.validation.HelperUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Comparator;
import java.util.UUID;

/**
 * Work-from-home requests. An approved grant with an allocated window lets the employee bypass
 * the location, network and time checks while the window is active.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WfhGrantService {

    private static final Comparator<WfhGrant> NEWEST_REQUEST_FIRST =
            Comparator.comparing(WfhGrant::getRequestedAt, Comparator.nullsLast(Comparator.reverseOrder()));

    private static final Comparator<WfhGrant> NEWEST_DECISION_FIRST =
            Comparator.comparing(WfhGrant::getDecidedAt, Comparator.nullsLast(Comparator.reverseOrder()));

    private final WfhGrantRepository repository;
    private final Clock clock;

    /* =========================
       Employee
       ========================= */

    public Mono<WfhGrant> submit(String username, String reason) {
        if (StringUtils.isBlank(reason)) {
            return Mono.error(new ValidationException("reason", "Reason is required"));
        }
        return findPending(username)
                .flatMap(pending -> Mono.<WfhGrant>error(
                        new ConflictException("status", "You already have a pending WFH request")))
                .switchIfEmpty(Mono.defer(() -> repository.save(WfhGrant.builder()
                        .id(UUID.randomUUID().toString())
                        .username(username)
                        .status(WfhStatus.PENDING)
                        .reason(reason.trim())
                        .requestedAt(clock.instant())
                        .build())))
                .doOnSuccess(grant -> log.info("🏠 WFH request {} submitted by {}",
                        grant.getId(), HelperUtils.maskUsername(username)));
    }

    public Mono<WfhGrant> latestFor(String username) {
        return repository.findByUsername(username)
                .sort(NEWEST_REQUEST_FIRST)
                .next()
                .switchIfEmpty(Mono.error(new ResourceNotFoundException("WFH request", username)));
    }

    /**
     * The most recently approved grant of the user whose window is active at the current instant.
     */
    public Mono<WfhGrant> findActiveGrant(String username) {
        Instant now = clock.instant();
        return repository.findByUsername(username)
                .filter(WfhGrant::isApproved)
                .sort(NEWEST_DECISION_FIRST)
                .next()
                .filter(grant -> grant.isWindowActive(now));
    }

    /* =========================
       Admin
       ========================= */

    public Flux<WfhGrant> listAll() {
        return repository.findAll().sort(NEWEST_REQUEST_FIRST);
    }

    public Mono<WfhGrant> decide(String username, WfhDecisionRequest request, String admin) {
        WfhStatus status = request.getStatus();
        if (status != WfhStatus.APPROVED && status != WfhStatus.REJECTED) {
            return Mono.error(new ValidationException("status", "Status must be APPROVED or REJECTED"));
        }

        return Mono.fromCallable(() -> parseWindow(request))
                .flatMap(window -> findPending(username)
                        .switchIfEmpty(Mono.error(new ResourceNotFoundException("Pending WFH request", username)))
                        .map(pending -> {
                            WfhGrant.WfhGrantBuilder decided = pending.toBuilder()
                                    .status(status)
                                    .adminComment(StringUtils.trimToNull(request.getAdminComment()))
                                    .decidedAt(clock.instant())
                                    .decidedBy(admin);
                            if (status == WfhStatus.APPROVED && window.length == 2) {
                                decided.accessStart(window[0]).accessEnd(window[1]);
                            }
                            return decided.build();
                        }))
                .flatMap(repository::save)
                .doOnSuccess(grant -> log.info("🏠 WFH request {} {} by {} for {}",
                        grant.getId(), status, HelperUtils.maskUsername(admin), HelperUtils.maskUsername(username)));
    }

    /* =========================
       Internals
       ========================= */

    private Mono<WfhGrant> findPending(String username) {
        return repository.findByUsername(username)
                .filter(grant -> grant.getStatus() == WfhStatus.PENDING)
                .next();
    }

    /**
     * Empty array when no window was supplied; both bounds are required together.
     */
    private static Instant[] parseWindow(WfhDecisionRequest request) {
        String start = StringUtils.trimToNull(request.getAccessStart());
        String end = StringUtils.trimToNull(request.getAccessEnd());
        if (start == null && end == null) {
            return new Instant[0];
        }
        if (start == null || end == null) {
            throw new ValidationException("accessEnd", "Both access start and end are required");
        }
        Instant from = parseInstant("accessStart", start);
        Instant to = parseInstant("accessEnd", end);
        if (!to.isAfter(from)) {
            throw new ValidationException("accessEnd", "Access end must be after access start");
        }
        return new Instant[]{from, to};
    }

    private static Instant parseInstant(String field, String value) {
        try {
            return OffsetDateTime.parse(value).toInstant();
        } catch (DateTimeParseException e) {
            // no offset given: read as UTC
            try {
                return LocalDateTime.parse(value).toInstant(ZoneOffset.UTC);
            } catch (DateTimeParseException ignored) {
                throw new ValidationException(field, "Invalid ISO-8601 date-time: " + value);
            }
        }
    }
}
