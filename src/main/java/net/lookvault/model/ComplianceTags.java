package net.lookvault.model;

import java.util.Map;

/**
 * Disclosure flags attached to a rendered asset at render time.
 *
 * @param aiDisclosureApplied whether the AI-generated disclosure was attached
 * @param syntheticWatermarkApplied whether the render provider was asked to watermark the output
 * @param disclosureMetadata IPTC-style descriptive metadata stored alongside the asset
 */
public record ComplianceTags(
    boolean aiDisclosureApplied,
    boolean syntheticWatermarkApplied,
    Map<String, Object> disclosureMetadata
) {

    public ComplianceTags {
        disclosureMetadata = disclosureMetadata == null ? Map.of() : Map.copyOf(disclosureMetadata);
    }

    /**
     * Flags for listing-only rows that were never rendered.
     */
    public static ComplianceTags none() {
        return new ComplianceTags(false, false, Map.of());
    }
}
