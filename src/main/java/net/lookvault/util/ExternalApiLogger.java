package net.lookvault.util;

import org.slf4j.Logger;

/**
 * Centralized console logging for calls to paid upstreams.
 *
 * These logs trace the tiered product flow:
 * - asset library (free)
 * - shopping search provider (primary)
 * - marketplace browse provider (secondary)
 * - curated fallback catalog (floor)
 * and every try-on render dispatch.
 */
public class ExternalApiLogger {

    private static final String PREFIX = "[EXTERNAL-API]";

    private ExternalApiLogger() {
    }

    /**
     * Log an external API call attempt
     */
    public static void logApiCallAttempt(Logger log, String apiName, String operation, String query) {
        log.info(String.format("%s [%s] ATTEMPT: %s for query='%s'", PREFIX, apiName, operation, query));
    }

    /**
     * Log an external API call success
     */
    public static void logApiCallSuccess(Logger log, String apiName, String operation, String query, int resultCount) {
        log.info(String.format("%s [%s] SUCCESS: %s returned %d result(s) for query='%s'",
            PREFIX, apiName, operation, resultCount, query));
    }

    /**
     * Log an external API call failure
     */
    public static void logApiCallFailure(Logger log, String apiName, String operation, String query, String reason) {
        log.warn(String.format("%s [%s] FAILURE: %s failed for query='%s' - %s",
            PREFIX, apiName, operation, query, reason));
    }

    /**
     * Log a provider skipped because it has no credentials configured
     */
    public static void logProviderDisabled(Logger log, String apiName, String query) {
        log.debug(String.format("%s [%s] DISABLED: credentials not configured, skipping query='%s'",
            PREFIX, apiName, query));
    }

    /**
     * Log the start of a tiered search
     */
    public static void logTieredSearchStart(Logger log, String query, int cachedResults, int threshold) {
        log.info(String.format("%s [TIERED-SEARCH] START: query='%s', cachedResults=%d, sufficiencyThreshold=%d",
            PREFIX, query, cachedResults, threshold));
    }

    /**
     * Log the completion of a tiered search
     */
    public static void logTieredSearchComplete(Logger log, String query, int cachedResults, int providerResults,
                                               int totalResults, boolean fallbackUsed) {
        log.info(String.format("%s [TIERED-SEARCH] COMPLETE: query='%s', cachedResults=%d, providerResults=%d, totalResults=%d, fallback=%s",
            PREFIX, query, cachedResults, providerResults, totalResults, fallbackUsed));
    }

    /**
     * Log the start of background indexing for a specific context (search, trends)
     */
    public static void logIndexingStart(Logger log, String context, int recordCount) {
        log.info(String.format("%s [%s] INDEXING START: %d listing(s)", PREFIX, context, recordCount));
    }

    /**
     * Log background indexing completion
     */
    public static void logIndexingComplete(Logger log, String context, int persisted, int failed) {
        log.info(String.format("%s [%s] INDEXING COMPLETE: persisted=%d, failed=%d", PREFIX, context, persisted, failed));
    }

    /**
     * Log a per-record indexing failure
     */
    public static void logIndexingFailure(Logger log, String context, String contentHash, String reason) {
        log.warn(String.format("%s [%s] INDEXING FAILURE: hash=%s - %s", PREFIX, context, contentHash, reason));
    }
}
