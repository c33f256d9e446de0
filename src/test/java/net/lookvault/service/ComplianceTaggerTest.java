package net.lookvault.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.Mockito.when;

import net.lookvault.model.ComplianceTags;
import net.lookvault.service.render.TryOnRenderProvider;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ComplianceTaggerTest {

    @Mock
    private TryOnRenderProvider renderProvider;

    @Test
    void tag_AlwaysAppliesDisclosureAndReportsProviderWatermark() {
        when(renderProvider.appliesSyntheticWatermark()).thenReturn(true);

        ComplianceTags tags = new ComplianceTagger(renderProvider).tag("abc123");

        assertThat(tags.aiDisclosureApplied()).isTrue();
        assertThat(tags.syntheticWatermarkApplied()).isTrue();
        assertThat(tags.disclosureMetadata())
            .containsEntry("digitalSourceType", ComplianceTagger.DIGITAL_SOURCE_TYPE)
            .containsEntry("assetId", "abc123");
        assertThat((String) tags.disclosureMetadata().get("imageDescription")).contains("abc123");
    }

    @Test
    void tag_IsStableForTheSameHash() {
        when(renderProvider.appliesSyntheticWatermark()).thenReturn(false);
        ComplianceTagger tagger = new ComplianceTagger(renderProvider);

        assertThat(tagger.tag("abc123")).isEqualTo(tagger.tag("abc123"));
    }

    @Test
    void tag_RequiresHash() {
        ComplianceTagger tagger = new ComplianceTagger(renderProvider);

        assertThrows(IllegalArgumentException.class, () -> tagger.tag(" "));
    }
}
