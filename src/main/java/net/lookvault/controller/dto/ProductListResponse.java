package net.lookvault.controller.dto;

import java.util.List;
import net.lookvault.model.UnifiedProduct;

public record ProductListResponse(List<UnifiedProduct> items) {
}
