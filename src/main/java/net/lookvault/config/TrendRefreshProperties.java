package net.lookvault.config;

import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.util.Assert;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration for the trending asset refresh.
 */
@Component
@ConfigurationProperties(prefix = "lookvault.trends")
public class TrendRefreshProperties {

    /**
     * Whether the scheduled refresh runs.
     */
    private boolean enabled = true;

    /**
     * Cron expression for the refresh job.
     */
    private String cron = "0 0 */6 * * *";

    /**
     * Seed keywords queried on every refresh.
     */
    private List<String> keywords = new ArrayList<>(List.of(
        "quiet luxury",
        "mob wife aesthetic",
        "gorpcore",
        "ballet core",
        "capsule wardrobe",
        "Y2K fashion",
        "dark academia",
        "sustainable fashion"
    ));

    /**
     * Listings fetched per keyword.
     */
    private int itemsPerKeyword = 4;

    /**
     * Rows whose trending flag was not refreshed within this window lose it.
     */
    private Duration staleAfter = Duration.ofDays(2);

    @PostConstruct
    void validate() {
        Assert.isTrue(itemsPerKeyword > 0, "lookvault.trends.items-per-keyword must be positive");
        Assert.isTrue(!staleAfter.isNegative(), "lookvault.trends.stale-after must be non-negative");
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getCron() {
        return cron;
    }

    public void setCron(String cron) {
        this.cron = cron;
    }

    public List<String> getKeywords() {
        return keywords;
    }

    public void setKeywords(List<String> keywords) {
        this.keywords = keywords;
    }

    public int getItemsPerKeyword() {
        return itemsPerKeyword;
    }

    public void setItemsPerKeyword(int itemsPerKeyword) {
        this.itemsPerKeyword = itemsPerKeyword;
    }

    public Duration getStaleAfter() {
        return staleAfter;
    }

    public void setStaleAfter(Duration staleAfter) {
        this.staleAfter = staleAfter;
    }
}
