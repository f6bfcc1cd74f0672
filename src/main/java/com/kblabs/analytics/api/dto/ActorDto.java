package com.kblabs.analytics.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Who triggered the event")
public class ActorDto {

    @Schema(description = "Actor kind", example = "user", allowableValues = {"user", "agent", "ci"})
    private String type;

    @Schema(description = "Actor identifier", example = "u-42")
    private String id;

    @Schema(description = "Display name", example = "Jane")
    private String name;
}
