package com.kblabs.analytics.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Source attribution: emitting product and its version. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Product that emitted the event")
public class SourceDto {

    @NotBlank(message = "source.product is required")
    @Schema(description = "Product name", example = "@kb-labs/cli")
    private String product;

    @NotBlank(message = "source.version is required")
    @Schema(description = "Product version", example = "1.4.0")
    private String version;
}
