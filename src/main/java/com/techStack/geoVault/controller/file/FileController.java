package com.techStack.geoVault.controller.file;

import com.techStack.geoVault.config.storage.FileStorageProperties;
import com.techStack.geoVault.dto.request.FileAccessRequest;
import com.techStack.geoVault.dto.response.ApiResponse;
import com.techStack.geoVault.exception.validation.ValidationException;
import com.techStack.geoVault.models.auth.AuthenticatedUser;
import com.techStack.geoVault.models.file.FileListItem;
import com.techStack.geoVault.models.file.FileMetadata;
import com.techStack.geoVault.models.file.FileStats;
import com.techStack.geoVault.models.policy.AccessRequest;
import com.techStack.geoVault.service.file.FileGatewayService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.buffer.DataBufferLimitException;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.multipart.FilePart;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.util.List;

@Slf4j
@RestController
@RequestMapping("/api/files")
@RequiredArgsConstructor
public class FileController {

    private final FileGatewayService fileGatewayService;
    private final FileStorageProperties storageProperties;

    /**
     * POST /api/files/upload (multipart, part name {@code file})
     */
    @PostMapping(value = "/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public Mono<ResponseEntity<ApiResponse<FileMetadata>>> upload(
            @RequestPart("file") Mono<FilePart> file,
            @AuthenticationPrincipal AuthenticatedUser user) {

        int limit = (int) Math.min(Integer.MAX_VALUE - 1, storageProperties.getMaxUploadBytes() + 1);

        return file
                .switchIfEmpty(Mono.error(new ValidationException("file", "File is required")))
                .flatMap(part -> DataBufferUtils.join(part.content(), limit)
                        .map(buffer -> {
                            byte[] bytes = new byte[buffer.readableByteCount()];
                            buffer.read(bytes);
                            DataBufferUtils.release(buffer);
                            return bytes;
                        })
                        .defaultIfEmpty(new byte[0])
                        .onErrorMap(DataBufferLimitException.class, e -> new ValidationException("file",
                                "File exceeds the maximum size of " + storageProperties.getMaxUploadBytes() + " bytes"))
                        .flatMap(bytes -> fileGatewayService.upload(bytes, part.filename(), user)))
                .map(saved -> ResponseEntity.status(HttpStatus.CREATED)
                        .body(ApiResponse.success("File uploaded and encrypted", saved)));
    }

    /**
     * GET /api/files?latitude=&longitude=&network=
     */
    @GetMapping
    public Mono<ResponseEntity<ApiResponse<List<FileListItem>>>> list(
            @RequestParam(required = false) Double latitude,
            @RequestParam(required = false) Double longitude,
            @RequestParam(required = false) String network,
            @AuthenticationPrincipal AuthenticatedUser user) {

        return fileGatewayService.list(user, new AccessRequest(latitude, longitude, network))
                .collectList()
                .map(files -> ResponseEntity.ok(ApiResponse.success(files)));
    }

    /**
     * POST /api/files/access. Streams the decrypted content on allow; 403 with the per-check
     * reasons on deny.
     */
    @PostMapping("/access")
    public Mono<ResponseEntity<byte[]>> access(
            @Valid @RequestBody FileAccessRequest request,
            @AuthenticationPrincipal AuthenticatedUser user) {

        return fileGatewayService.access(user, request.getFileId(), request.toAccessRequest())
                .map(content -> ResponseEntity.ok()
                        .contentType(MediaType.parseMediaType(content.mediaType()))
                        .header(HttpHeaders.CONTENT_DISPOSITION, ContentDisposition.attachment()
                                .filename(content.filename(), StandardCharsets.UTF_8)
                                .build()
                                .toString())
                        .header("X-Content-Type-Options", "nosniff")
                        .body(content.bytes()));
    }

    @DeleteMapping("/{fileId}")
    public Mono<ResponseEntity<ApiResponse<Void>>> delete(
            @PathVariable String fileId,
            @AuthenticationPrincipal AuthenticatedUser user) {

        return fileGatewayService.delete(fileId, user)
                .then(Mono.fromSupplier(() -> ResponseEntity.ok(ApiResponse.success("File deleted"))));
    }

    @GetMapping("/stats")
    public Mono<ResponseEntity<ApiResponse<FileStats>>> stats() {
        return fileGatewayService.stats()
                .map(stats -> ResponseEntity.ok(ApiResponse.success(stats)));
    }
}
