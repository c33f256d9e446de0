package net.lookvault.service;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import net.lookvault.adapters.persistence.GenerationJobRepository;
import net.lookvault.config.AssetCacheProperties;
import net.lookvault.model.GenerationCacheResult;
import net.lookvault.model.GenerationJob;
import net.lookvault.model.GenerationJobStatus;
import net.lookvault.model.GenerationParams;
import net.lookvault.util.CanonicalHasher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Answers "has this user already paid for exactly this generation recently?".
 * <p>
 * Lookups are scoped to the requesting user and to the freshness window. A miss hands back the
 * content hash so the caller can tag the job it is about to start.
 */
@Service
public class GenerationRequestCache {

    private static final Logger logger = LoggerFactory.getLogger(GenerationRequestCache.class);

    private final GenerationJobRepository generationJobRepository;
    private final AssetCacheProperties cacheProperties;
    private final Clock clock;

    @Autowired
    public GenerationRequestCache(GenerationJobRepository generationJobRepository, AssetCacheProperties cacheProperties) {
        this(generationJobRepository, cacheProperties, Clock.systemUTC());
    }

    GenerationRequestCache(GenerationJobRepository generationJobRepository, AssetCacheProperties cacheProperties, Clock clock) {
        this.generationJobRepository = generationJobRepository;
        this.cacheProperties = cacheProperties;
        this.clock = clock;
    }

    /**
     * Looks for a completed, fresh job of {@code userId} with identical output-affecting parameters.
     *
     * @param userId owner of the job; blank always misses
     * @param params generation parameters, defaults applied before hashing
     * @return a hit with the stored output, or a miss carrying the hash
     */
    public GenerationCacheResult check(String userId, GenerationParams params) {
        GenerationParams effective = params != null
            ? params
            : new GenerationParams(null, null, null, null, null, null, null, null);
        String contentHash = CanonicalHasher.hash(effective.toCanonicalFields());

        if (!StringUtils.hasText(userId)) {
            logger.debug("Generation cache check without user; reporting miss for {}", contentHash);
            return GenerationCacheResult.miss(contentHash);
        }

        Instant createdSince = clock.instant().minus(cacheProperties.getGenerationFreshness());
        try {
            Optional<GenerationJob> match = generationJobRepository.findLatestCompleted(userId.trim(), contentHash, createdSince);
            if (match.isPresent()) {
                logger.info("Generation cache HIT for user {} (job {}, model {})", userId, match.get().id(), match.get().model());
                return GenerationCacheResult.hit(contentHash, match.get());
            }
            logger.debug("Generation cache MISS for user {} ({})", userId, contentHash);
        } catch (DataAccessException ex) {
            logger.warn("Generation cache lookup failed for user {}; treating as miss: {}", userId, ex.getMessage());
        }
        return GenerationCacheResult.miss(contentHash);
    }

    /**
     * Records a new {@code pending} job under the hash returned by a miss.
     */
    public GenerationJob registerJob(String userId, String contentHash, String model) {
        if (!StringUtils.hasText(contentHash)) {
            throw new IllegalArgumentException("contentHash is required");
        }
        String effectiveModel = StringUtils.hasText(model) ? model : GenerationParams.DEFAULT_MODEL;
        GenerationJob job = generationJobRepository.insertPending(userId, contentHash, effectiveModel);
        logger.info("Registered generation job {} for user {}", job.id(), userId);
        return job;
    }

    /**
     * Marks a job completed with its output, making it eligible for cache hits.
     *
     * @return {@code false} when the job does not exist
     */
    public boolean completeJob(UUID jobId, String outputReference) {
        if (!StringUtils.hasText(outputReference)) {
            throw new IllegalArgumentException("outputReference is required to complete a job");
        }
        boolean updated = generationJobRepository.updateStatus(jobId, GenerationJobStatus.COMPLETED, outputReference);
        if (!updated) {
            logger.warn("Cannot complete unknown generation job {}", jobId);
        }
        return updated;
    }

    public boolean failJob(UUID jobId) {
        boolean updated = generationJobRepository.updateStatus(jobId, GenerationJobStatus.FAILED, null);
        if (!updated) {
            logger.warn("Cannot fail unknown generation job {}", jobId);
        }
        return updated;
    }
}
