package net.lookvault.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.util.StringUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

/**
 * Rewrites merchant links into attributed affiliate links.
 * <p>
 * Only ever called on read paths: the stored {@code merchant_url} stays raw so attribution
 * is computed fresh for whoever is viewing the listing. Pure and deterministic, never throws.
 */
@Service
@Slf4j
public class AffiliateLinkService {

    public static final String PLACEHOLDER_URL = "#";
    static final String SKIMLINKS_REDIRECT = "https://go.skimresources.com";
    static final String USER_PARAM = "xcust";
    static final String MARKETPLACE_USER_PARAM = "customid";
    static final String MARKETPLACE_CAMPAIGN_PARAM = "campid";

    private final String skimlinksPublisherId;
    private final String ebayCampaignId;

    public AffiliateLinkService(
            @Value("${affiliate.skimlinks.publisher-id:#{null}}") String skimlinksPublisherId,
            @Value("${affiliate.ebay.campaign-id:#{null}}") String ebayCampaignId) {
        this.skimlinksPublisherId = StringUtils.hasText(skimlinksPublisherId) ? skimlinksPublisherId.trim() : null;
        this.ebayCampaignId = StringUtils.hasText(ebayCampaignId) ? ebayCampaignId.trim() : null;
    }

    /**
     * Builds the link a given user should follow for a merchant URL.
     * Links work even without affiliate ids: the user sub-id is still attached to the raw link.
     *
     * @param merchantUrl raw merchant URL as stored
     * @param userId requesting user, may be {@code null}
     * @return the attributed link, the trimmed input for non-http(s) links,
     *         or {@link #PLACEHOLDER_URL} when there is nothing to link to
     */
    public String wrap(String merchantUrl, String userId) {
        if (!StringUtils.hasText(merchantUrl) || PLACEHOLDER_URL.equals(merchantUrl.trim())) {
            return PLACEHOLDER_URL;
        }
        String url = merchantUrl.trim();
        String subId = StringUtils.hasText(userId) ? encode(userId.trim()) : null;
        try {
            if (!isWebUrl(url)) {
                return url;
            }
            if (isMarketplaceHost(url)) {
                return buildMarketplaceLink(url, subId);
            }
            if (skimlinksPublisherId != null) {
                return buildSkimlinksLink(url, subId);
            }
            return subId == null ? url : replaceParam(url, USER_PARAM, subId);
        } catch (IllegalArgumentException ex) {
            log.debug("Merchant URL '{}' could not be parsed; serving it without attribution: {}", url, ex.getMessage());
            return url;
        }
    }

    /**
     * Check if the affiliate network redirect is configured.
     */
    public boolean hasSkimlinksConfig() {
        return skimlinksPublisherId != null;
    }

    /**
     * Marketplace links carry attribution on the merchant URL itself.
     */
    private String buildMarketplaceLink(String url, String subId) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromUriString(url)
            .replaceQueryParam(MARKETPLACE_CAMPAIGN_PARAM)
            .replaceQueryParam(MARKETPLACE_USER_PARAM);
        if (ebayCampaignId != null) {
            builder.queryParam(MARKETPLACE_CAMPAIGN_PARAM, encode(ebayCampaignId));
        }
        if (subId != null) {
            builder.queryParam(MARKETPLACE_USER_PARAM, subId);
        }
        return builder.build(false).toUriString();
    }

    private String buildSkimlinksLink(String url, String subId) {
        String target = UriComponentsBuilder.fromUriString(url)
            .replaceQueryParam(USER_PARAM)
            .build(false)
            .toUriString();
        StringBuilder link = new StringBuilder(String.format(
            "%s?id=%s&xs=1&url=%s",
            SKIMLINKS_REDIRECT,
            encode(skimlinksPublisherId),
            encode(target)
        ));
        if (subId != null) {
            link.append('&').append(USER_PARAM).append('=').append(subId);
        }
        return link.toString();
    }

    private static String replaceParam(String url, String name, String encodedValue) {
        return UriComponentsBuilder.fromUriString(url)
            .replaceQueryParam(name, encodedValue)
            .build(false)
            .toUriString();
    }

    private static boolean isWebUrl(String url) {
        String scheme = URI.create(url.replace(" ", "%20")).getScheme();
        return "http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme);
    }

    private static boolean isMarketplaceHost(String url) {
        String host = URI.create(url.replace(" ", "%20")).getHost();
        if (host == null) {
            return false;
        }
        String normalized = host.toLowerCase(Locale.ROOT);
        return normalized.startsWith("ebay.") || normalized.contains(".ebay.");
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
