package net.lookvault.controller.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ProductSearchRequest(
    String query,
    String category,
    String brand,

    @JsonProperty("user_id")
    String userId
) {
}
