package net.lookvault.controller;

import java.util.UUID;
import java.util.function.BooleanSupplier;
import lombok.extern.slf4j.Slf4j;
import net.lookvault.controller.dto.GenerationCacheCheckRequest;
import net.lookvault.controller.dto.GenerationCacheCheckResponse;
import net.lookvault.controller.dto.GenerationJobRequest;
import net.lookvault.controller.dto.GenerationJobResponse;
import net.lookvault.controller.support.ErrorResponseUtils;
import net.lookvault.model.GenerationCacheResult;
import net.lookvault.model.GenerationJob;
import net.lookvault.model.GenerationParams;
import net.lookvault.service.GenerationRequestCache;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Generation cache lookups plus the job lifecycle calls that make later lookups hit.
 */
@RestController
@RequestMapping("/api/generation-cache")
@Slf4j
public class GenerationCacheController {

    private final GenerationRequestCache generationRequestCache;

    public GenerationCacheController(GenerationRequestCache generationRequestCache) {
        this.generationRequestCache = generationRequestCache;
    }

    @PostMapping("/check")
    public ResponseEntity<Object> check(@RequestBody GenerationCacheCheckRequest request) {
        if (request == null) {
            return ErrorResponseUtils.badRequest("request body is required");
        }
        GenerationParams params = request.generationParams() == null ? null : request.generationParams().toParams();
        GenerationCacheResult result = generationRequestCache.check(request.userId(), params);
        return ResponseEntity.ok(GenerationCacheCheckResponse.from(result));
    }

    @PostMapping("/jobs")
    public ResponseEntity<Object> registerJob(@RequestBody GenerationJobRequest request) {
        if (request == null || !StringUtils.hasText(request.userId()) || !StringUtils.hasText(request.contentHash())) {
            return ErrorResponseUtils.badRequest("user_id and content_hash are required");
        }
        try {
            GenerationJob job = generationRequestCache.registerJob(request.userId().trim(), request.contentHash().trim(), request.model());
            return ResponseEntity.status(HttpStatus.CREATED).body(GenerationJobResponse.from(job));
        } catch (DataAccessException ex) {
            log.error("Failed to register generation job for user {}: {}", request.userId(), ex.getMessage(), ex);
            return ErrorResponseUtils.internalServerError("Failed to register generation job");
        }
    }

    @PostMapping("/jobs/{jobId}/complete")
    public ResponseEntity<Object> completeJob(@PathVariable UUID jobId, @RequestBody GenerationJobRequest request) {
        if (request == null || !StringUtils.hasText(request.outputReference())) {
            return ErrorResponseUtils.badRequest("output_reference is required");
        }
        return lifecycleResult(jobId, () -> generationRequestCache.completeJob(jobId, request.outputReference().trim()));
    }

    @PostMapping("/jobs/{jobId}/fail")
    public ResponseEntity<Object> failJob(@PathVariable UUID jobId) {
        return lifecycleResult(jobId, () -> generationRequestCache.failJob(jobId));
    }

    private ResponseEntity<Object> lifecycleResult(UUID jobId, BooleanSupplier update) {
        try {
            if (!update.getAsBoolean()) {
                return ErrorResponseUtils.error(HttpStatus.NOT_FOUND, "not_found", "Unknown generation job " + jobId);
            }
            return ResponseEntity.noContent().build();
        } catch (DataAccessException ex) {
            log.error("Failed to update generation job {}: {}", jobId, ex.getMessage(), ex);
            return ErrorResponseUtils.internalServerError("Failed to update generation job");
        }
    }
}
