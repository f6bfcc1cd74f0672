package com.kblabs.analytics.api.controller;

import com.kblabs.analytics.api.dto.SourceDto;
import com.kblabs.analytics.domain.model.AnalyticsContext;
import com.kblabs.analytics.domain.service.AnalyticsContextHolder;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Source attribution applied to events sent without one. */
@RestController
@RequestMapping("/source")
@RequiredArgsConstructor
@Tag(name = "Source", description = "Default source attribution")
public class SourceController {

    private final AnalyticsContextHolder contextHolder;

    @GetMapping
    @Operation(summary = "Get the current source")
    public ResponseEntity<SourceDto> getSource() {
        AnalyticsContext.Source source = contextHolder.getSource();
        return ResponseEntity.ok(SourceDto.builder()
                .product(source.getProduct())
                .version(source.getVersion())
                .build());
    }

    @PutMapping
    @Operation(summary = "Replace the current source", description = "Applies to events enriched after the call")
    public ResponseEntity<SourceDto> setSource(@Valid @RequestBody SourceDto source) {
        contextHolder.setSource(source.getProduct(), source.getVersion());
        return ResponseEntity.ok(source);
    }
}
