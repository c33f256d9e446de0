package net.lookvault.service;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class AffiliateLinkServiceTest {

    @Test
    void wrap_ReturnsPlaceholderWhenThereIsNothingToLinkTo() {
        AffiliateLinkService service = new AffiliateLinkService(null, null);

        assertThat(service.wrap(null, "u1")).isEqualTo(AffiliateLinkService.PLACEHOLDER_URL);
        assertThat(service.wrap("  ", "u1")).isEqualTo(AffiliateLinkService.PLACEHOLDER_URL);
        assertThat(service.wrap("#", "u1")).isEqualTo(AffiliateLinkService.PLACEHOLDER_URL);
    }

    @Test
    void wrap_AttachesUserSubIdWithoutAffiliateConfig() {
        AffiliateLinkService service = new AffiliateLinkService(null, null);

        assertThat(service.wrap("https://shop.example.com/p/1?color=red", "u1"))
            .isEqualTo("https://shop.example.com/p/1?color=red&xcust=u1");
    }

    @Test
    void wrap_ReplacesExistingSubIdRatherThanDuplicatingIt() {
        AffiliateLinkService service = new AffiliateLinkService(null, null);

        assertThat(service.wrap("https://shop.example.com/p/1?xcust=someone-else", "u1"))
            .isEqualTo("https://shop.example.com/p/1?xcust=u1");
    }

    @Test
    void wrap_LeavesRawLinkAloneForAnonymousUsers() {
        AffiliateLinkService service = new AffiliateLinkService(null, null);

        assertThat(service.wrap(" https://shop.example.com/p/1 ", null)).isEqualTo("https://shop.example.com/p/1");
    }

    @Test
    void wrap_RoutesThroughAffiliateRedirectWhenConfigured() {
        AffiliateLinkService service = new AffiliateLinkService("123X456", null);

        String link = service.wrap("https://shop.example.com/p/1?xcust=stale", "u1");

        assertThat(service.hasSkimlinksConfig()).isTrue();
        assertThat(link).isEqualTo(
            "https://go.skimresources.com?id=123X456&xs=1&url=https%3A%2F%2Fshop.example.com%2Fp%2F1&xcust=u1");
    }

    @Test
    void wrap_UsesCampaignParametersForMarketplaceLinks() {
        AffiliateLinkService service = new AffiliateLinkService("123X456", "5338");

        String link = service.wrap("https://www.ebay.com/itm/123?campid=old&customid=stale", "u1");

        assertThat(link).isEqualTo("https://www.ebay.com/itm/123?campid=5338&customid=u1");
    }

    @Test
    void wrap_EncodesUserIds() {
        AffiliateLinkService service = new AffiliateLinkService(null, null);

        assertThat(service.wrap("https://shop.example.com/p/1", "user one&two"))
            .isEqualTo("https://shop.example.com/p/1?xcust=user+one%26two");
    }

    @Test
    void wrap_IsDeterministicAndNeverMutatesItsInput() {
        AffiliateLinkService service = new AffiliateLinkService("123X456", null);
        String raw = "https://shop.example.com/p/1";

        assertThat(service.wrap(raw, "u1")).isEqualTo(service.wrap(raw, "u1"));
        assertThat(raw).isEqualTo("https://shop.example.com/p/1");
    }

    @Test
    void wrap_LeavesNonWebLinksUntouched() {
        AffiliateLinkService plain = new AffiliateLinkService(null, null);
        AffiliateLinkService redirecting = new AffiliateLinkService("123X456", "5338");

        assertThat(plain.wrap("mailto:a@b", "u1")).isEqualTo("mailto:a@b");
        assertThat(redirecting.wrap("mailto:a@b", "u1")).isEqualTo("mailto:a@b");
        assertThat(plain.wrap("/p/1", "u1")).isEqualTo("/p/1");
    }
}
