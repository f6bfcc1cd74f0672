package com.kblabs.analytics.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/** Stored as an "identity" event whose payload is userId plus the traits. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "User identification payload")
public class IdentifyRequest {

    @NotBlank(message = "userId is required")
    @Schema(description = "User identifier", example = "u-42")
    private String userId;

    @Schema(description = "User traits", example = "{\"plan\": \"pro\"}")
    private Map<String, Object> traits;
}
