package net.lookvault.config;

import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.util.Assert;

import java.time.Duration;

/**
 * Strongly typed policy knobs for the product asset and generation caches.
 */
@Component
@ConfigurationProperties(prefix = "lookvault.cache")
public class AssetCacheProperties {

    /**
     * Minimum number of library hits that serves a search without calling any provider.
     */
    private int sufficiencyThreshold = 5;

    /**
     * Maximum rows read from the asset library per text lookup.
     */
    private int textLookupLimit = 20;

    /**
     * Listings requested from each upstream provider per search.
     */
    private int providerResultLimit = 10;

    /**
     * Individual timeout applied to every provider call.
     */
    private Duration providerTimeout = Duration.ofSeconds(8);

    /**
     * Ceiling for a single try-on render.
     */
    private Duration renderTimeout = Duration.ofMinutes(3);

    /**
     * Age beyond which a completed generation job is no longer served from cache.
     */
    private Duration generationFreshness = Duration.ofHours(24);

    /**
     * Number of leading normalized title characters used as the merge key when no offer id exists.
     */
    private int titleMergeKeyLength = 40;

    @PostConstruct
    void validate() {
        Assert.isTrue(sufficiencyThreshold > 0, "lookvault.cache.sufficiency-threshold must be positive");
        Assert.isTrue(textLookupLimit >= sufficiencyThreshold,
                "lookvault.cache.text-lookup-limit must be at least the sufficiency threshold");
        Assert.isTrue(providerResultLimit > 0, "lookvault.cache.provider-result-limit must be positive");
        Assert.isTrue(!providerTimeout.isNegative() && !providerTimeout.isZero(), "lookvault.cache.provider-timeout must be positive");
        Assert.isTrue(!renderTimeout.isNegative() && !renderTimeout.isZero(), "lookvault.cache.render-timeout must be positive");
        Assert.isTrue(!generationFreshness.isNegative(), "lookvault.cache.generation-freshness must be non-negative");
        Assert.isTrue(titleMergeKeyLength > 0, "lookvault.cache.title-merge-key-length must be positive");
    }

    public int getSufficiencyThreshold() {
        return sufficiencyThreshold;
    }

    public void setSufficiencyThreshold(int sufficiencyThreshold) {
        this.sufficiencyThreshold = sufficiencyThreshold;
    }

    public int getTextLookupLimit() {
        return textLookupLimit;
    }

    public void setTextLookupLimit(int textLookupLimit) {
        this.textLookupLimit = textLookupLimit;
    }

    public int getProviderResultLimit() {
        return providerResultLimit;
    }

    public void setProviderResultLimit(int providerResultLimit) {
        this.providerResultLimit = providerResultLimit;
    }

    public Duration getProviderTimeout() {
        return providerTimeout;
    }

    public void setProviderTimeout(Duration providerTimeout) {
        this.providerTimeout = providerTimeout;
    }

    public Duration getRenderTimeout() {
        return renderTimeout;
    }

    public void setRenderTimeout(Duration renderTimeout) {
        this.renderTimeout = renderTimeout;
    }

    public Duration getGenerationFreshness() {
        return generationFreshness;
    }

    public void setGenerationFreshness(Duration generationFreshness) {
        this.generationFreshness = generationFreshness;
    }

    public int getTitleMergeKeyLength() {
        return titleMergeKeyLength;
    }

    public void setTitleMergeKeyLength(int titleMergeKeyLength) {
        this.titleMergeKeyLength = titleMergeKeyLength;
    }
}
