package com.techStack.geoVault.service.file;

import com.techStack.geoVault.config.storage.FileStorageProperties;
import com.techStack.geoVault.exception.authorization.PermissionDeniedException;
import com.techStack.geoVault.exception.policy.PolicyDeniedException;
import com.techStack.geoVault.exception.resource.ResourceNotFoundException;
import com.techStack.geoVault.exception.validation.ValidationException;
import com.techStack.geoVault.models.audit.AccessAction;
import com.techStack.geoVault.models.auth.AuthenticatedUser;
import com.techStack.geoVault.models.file.FileContent;
import com.techStack.geoVault.models.file.FileListItem;
import com.techStack.geoVault.models.file.FileMetadata;
import com.techStack.geoVault.models.file.FileStats;
import com.techStack.geoVault.models.policy.AccessPolicy;
import com.techStack.geoVault.models.policy.AccessRequest;
import com.techStack.geoVault.models.policy.PolicyDecision;
import com.techStack.geoVault.models.policy.PolicyOverride;
import com.techStack.geoVault.models.user.Roles;
import com.techStack.geoVault.models.user.User;
import com.techStack.geoVault.models.wfh.WfhGrant;
import com.techStack.geoVault.repository.file.EncryptedObjectStore;
import com.techStack.geoVault.repository.file.FileMetadataRepository;
import com.techStack.geoVault.repository.user.UserRepository;
import com.techStack.geoVault.service.crypto.CryptoEngine;
import com.techStack.geoVault.service.observability.AuditLogService;
import com.techStack.geoVault.service.policy.PolicyConfigService;
import com.techStack.geoVault.service.policy.PolicyEngine;
import com.techStack.geoVault.service.wfh.WfhGrantService;
import com.techStack.geoVault.util.validation.HelperUtils;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.Base64;
import java.util.Comparator;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

import static com.techStack.geoVault.constants.SecurityConstants.MSG_ADMIN_REQUIRED;

/**
 * Upload, listing, policy-gated access and deletion of encrypted files.
 * <p>
 * Every access attempt is written to the audit log before the caller learns the outcome.
 * Plaintext and keys never reach the logs.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FileGatewayService {

    public static final String REASON_ADMIN = "Admin access";
    public static final String REASON_WFH_WINDOW = "WFH approved - within access window";
    public static final String REASON_MISSING_HINT = "location/network not provided";

    private final FileMetadataRepository metadataRepository;
    private final EncryptedObjectStore objectStore;
    private final UserRepository userRepository;
    private final CryptoEngine cryptoEngine;
    private final PolicyEngine policyEngine;
    private final PolicyConfigService policyConfigService;
    private final WfhGrantService wfhGrantService;
    private final AuditLogService auditLogService;
    private final MimeTypeResolver mimeTypeResolver;
    private final FileStorageProperties storageProperties;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    /* =========================
       Upload
       ========================= */

    public Mono<FileMetadata> upload(byte[] content, String originalFilename, AuthenticatedUser uploader) {
        if (!uploader.isAdmin()) {
            return Mono.error(new PermissionDeniedException(MSG_ADMIN_REQUIRED));
        }
        if (content == null) {
            return Mono.error(new ValidationException("file", "File is required"));
        }
        if (content.length > storageProperties.getMaxUploadBytes()) {
            return Mono.error(new ValidationException("file",
                    "File exceeds the maximum size of " + storageProperties.getMaxUploadBytes() + " bytes"));
        }

        String filename;
        try {
            filename = sanitizeFilename(originalFilename);
        } catch (ValidationException e) {
            return Mono.error(e);
        }

        String fileId = UUID.randomUUID().toString();
        byte[] key = cryptoEngine.generateFileKey();
        long started = System.nanoTime();
        long[] encryptedAt = new long[1];

        return cryptoEngine.encryptAsync(content, key)
                .doOnNext(blob -> encryptedAt[0] = System.nanoTime())
                .flatMap(blob -> objectStore.put(fileId, blob))
                .then(Mono.defer(() -> {
                    long storedAt = System.nanoTime();
                    log.info("⏱️ Upload {}: encrypt {} ms, store {} ms", fileId,
                            (encryptedAt[0] - started) / 1_000_000, (storedAt - encryptedAt[0]) / 1_000_000);

                    FileMetadata metadata = FileMetadata.builder()
                            .fileId(fileId)
                            .filename(filename)
                            .uploadedBy(uploader.username())
                            .uploadedAt(clock.instant())
                            .size(content.length)
                            .encryptionKey(Base64.getEncoder().encodeToString(key))
                            .algorithm(FileMetadata.ALGORITHM)
                            .encrypted(true)
                            .build();

                    return metadataRepository.save(metadata)
                            .onErrorResume(e -> objectStore.delete(fileId)
                                    .onErrorResume(cleanup -> {
                                        log.error("❌ Orphaned ciphertext {} left after metadata failure: {}",
                                                fileId, cleanup.getMessage());
                                        return Mono.empty();
                                    })
                                    .then(Mono.error(e)));
                }))
                .flatMap(saved -> auditLogService.recordFileEvent(uploader.username(), fileId, filename,
                                AccessAction.UPLOAD, true, "File uploaded", null, null)
                        .thenReturn(saved))
                .doOnSuccess(saved -> {
                    meterRegistry.counter("files.upload").increment();
                    log.info("📤 File {} ({} bytes) uploaded by {}", fileId, content.length,
                            HelperUtils.maskUsername(uploader.username()));
                });
    }

    /* =========================
       Listing
       ========================= */

    /**
     * Files visible to {@code user}, each annotated with whether it is accessible under the
     * current policy and the given request context.
     */
    public Flux<FileListItem> list(AuthenticatedUser user, AccessRequest request) {
        AccessRequest context = AccessRequest.orEmpty(request);

        return visibleFiles(user)
                .collectList()
                .flatMapMany(files -> decisionContext(user)
                        .map(ctx -> decide(user, context, ctx))
                        .flatMapMany(decision -> Flux.fromIterable(files)
                                .map(file -> FileListItem.builder()
                                        .fileId(file.getFileId())
                                        .filename(file.getFilename())
                                        .uploadedBy(file.getUploadedBy())
                                        .uploadedAt(file.getUploadedAt())
                                        .size(file.getSize())
                                        .accessible(decision.allowed())
                                        .accessReason(decision.reason())
                                        .validations(decision.validations())
                                        .build())));
    }

    /* =========================
       Access
       ========================= */

    public Mono<FileContent> access(AuthenticatedUser user, String fileId, AccessRequest request) {
        AccessRequest context = AccessRequest.orEmpty(request);

        return findVisible(user, fileId)
                .flatMap(file -> decisionContext(user)
                        .map(ctx -> decide(user, context, ctx))
                        .flatMap(decision -> auditLogService.recordFileEvent(user.username(), file.getFileId(),
                                        file.getFilename(),
                                        decision.allowed() ? AccessAction.ACCESS : AccessAction.DENIED,
                                        decision.allowed(), decision.reason(), context, decision.wfhGrantId())
                                .then(Mono.defer(() -> decision.allowed()
                                        ? decryptFile(file)
                                        : denied(user, file, decision)))));
    }

    /* =========================
       Delete / Stats
       ========================= */

    /**
     * Removes the ciphertext first; metadata is deleted only once the object is gone.
     */
    public Mono<Void> delete(String fileId, AuthenticatedUser admin) {
        if (!admin.isAdmin()) {
            return Mono.error(new PermissionDeniedException(MSG_ADMIN_REQUIRED));
        }
        return metadataRepository.findById(fileId)
                .switchIfEmpty(Mono.error(new ResourceNotFoundException("File", fileId)))
                .flatMap(file -> objectStore.delete(fileId)
                        .then(metadataRepository.deleteById(fileId))
                        .then(auditLogService.recordFileEvent(admin.username(), fileId, file.getFilename(),
                                AccessAction.DELETE, true, "File deleted", null, null)))
                .doOnSuccess(entry -> log.info("🗑️ File {} deleted by {}", fileId,
                        HelperUtils.maskUsername(admin.username())))
                .then();
    }

    public Mono<FileStats> stats() {
        return metadataRepository.findAll()
                .collectList()
                .zipWith(auditLogService.countAccessLogs())
                .map(tuple -> new FileStats(
                        tuple.getT1().size(),
                        tuple.getT1().stream().mapToLong(FileMetadata::getSize).sum(),
                        tuple.getT2()));
    }

    /* =========================
       Decision
       ========================= */

    private record DecisionContext(AccessPolicy policy, Optional<WfhGrant> activeGrant) {
    }

    private Mono<DecisionContext> decisionContext(AuthenticatedUser user) {
        Mono<Optional<WfhGrant>> grant = user.isAdmin()
                ? Mono.just(Optional.empty())
                : wfhGrantService.findActiveGrant(user.username()).map(Optional::of).defaultIfEmpty(Optional.empty());
        return policyConfigService.currentPolicy()
                .zipWith(grant, DecisionContext::new);
    }

    private PolicyDecision decide(AuthenticatedUser user, AccessRequest request, DecisionContext ctx) {
        if (user.isAdmin()) {
            return PolicyDecision.allow(REASON_ADMIN, Map.of());
        }

        PolicyOverride override = ctx.activeGrant().map(WfhGrant::toOverride).orElse(PolicyOverride.NONE);
        PolicyDecision decision = policyEngine.evaluate(request, ctx.policy(), override);

        if (decision.wfhGrantId() != null) {
            return PolicyDecision.allowByGrant(REASON_WFH_WINDOW, decision.validations(), decision.wfhGrantId());
        }
        if (!request.hasLocation() || !request.hasNetwork()) {
            return PolicyDecision.deny(REASON_MISSING_HINT, decision.validations());
        }
        return decision;
    }

    /* =========================
       Internals
       ========================= */

    private Flux<FileMetadata> visibleFiles(AuthenticatedUser user) {
        Flux<FileMetadata> all = metadataRepository.findAll()
                .sort(Comparator.comparing(FileMetadata::getUploadedAt, Comparator.nullsLast(Comparator.reverseOrder())));
        if (user.isAdmin()) {
            return all;
        }
        return adminUsernames().flatMapMany(admins -> all.filter(file -> admins.contains(file.getUploadedBy())));
    }

    private Mono<FileMetadata> findVisible(AuthenticatedUser user, String fileId) {
        Mono<FileMetadata> file = metadataRepository.findById(StringUtils.defaultString(fileId));
        Mono<FileMetadata> visible = user.isAdmin()
                ? file
                : adminUsernames().flatMap(admins -> file.filter(meta -> admins.contains(meta.getUploadedBy())));
        return visible.switchIfEmpty(Mono.error(new ResourceNotFoundException("File", fileId)));
    }

    private Mono<Set<String>> adminUsernames() {
        return userRepository.findByRole(Roles.ADMIN)
                .map(User::getUsername)
                .collect(Collectors.toSet());
    }

    private Mono<FileContent> decryptFile(FileMetadata file) {
        byte[] key = Base64.getDecoder().decode(file.getEncryptionKey());
        return objectStore.get(file.getFileId())
                .switchIfEmpty(Mono.error(new ResourceNotFoundException("Encrypted content", file.getFileId())))
                .flatMap(blob -> cryptoEngine.decryptAsync(blob, key))
                .map(plaintext -> new FileContent(file.getFilename(), mimeTypeResolver.resolve(file.getFilename()), plaintext))
                .doOnSuccess(content -> meterRegistry.counter("files.access.granted").increment());
    }

    private Mono<FileContent> denied(AuthenticatedUser user, FileMetadata file, PolicyDecision decision) {
        meterRegistry.counter("files.access.denied").increment();
        log.warn("🚫 Access to {} denied for {}: {}", file.getFileId(),
                HelperUtils.maskUsername(user.username()), decision.reason());
        return Mono.error(new PolicyDeniedException(decision));
    }

    String sanitizeFilename(String original) {
        String name = StringUtils.trimToEmpty(original);
        name = StringUtils.substringAfterLast("/" + name.replace('\\', '/'), "/");
        if (name.isEmpty() || ".".equals(name) || "..".equals(name)) {
            throw new ValidationException("file", "Filename is required");
        }
        if (name.length() > storageProperties.getMaxFilenameLength()) {
            throw new ValidationException("file", "Filename is too long");
        }
        return name;
    }
}
