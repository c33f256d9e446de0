package net.lookvault.service;

import java.util.LinkedHashMap;
import java.util.Map;
import net.lookvault.model.ComplianceTags;
import net.lookvault.service.render.TryOnRenderProvider;
import org.springframework.stereotype.Service;

/**
 * Produces the AI disclosure attached to a freshly rendered asset.
 * <p>
 * Runs once per render, before persistence; the stored tags describe what was done to that
 * asset at render time and are never re-derived on read.
 */
@Service
public class ComplianceTagger {

    static final String DIGITAL_SOURCE_TYPE =
        "http://cv.iptc.org/newscodes/digitalsourcetype/trainedAlgorithmicMedia";
    static final String CREDIT_LINE = "AI-generated image - LookVault virtual try-on";

    private final TryOnRenderProvider renderProvider;

    public ComplianceTagger(TryOnRenderProvider renderProvider) {
        this.renderProvider = renderProvider;
    }

    /**
     * @param contentHash asset content hash, embedded as the stable asset identifier
     * @return disclosure flags and IPTC-style metadata; identical for identical hashes
     */
    public ComplianceTags tag(String contentHash) {
        if (contentHash == null || contentHash.isBlank()) {
            throw new IllegalArgumentException("contentHash is required");
        }
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("digitalSourceType", DIGITAL_SOURCE_TYPE);
        metadata.put("imageDescription", "AI-generated virtual try-on render of product asset " + contentHash);
        metadata.put("creditLine", CREDIT_LINE);
        metadata.put("assetId", contentHash);
        return new ComplianceTags(true, renderProvider.appliesSyntheticWatermark(), metadata);
    }
}
