package com.kblabs.analytics.domain.query;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for FieldPathResolver.
 *
 * <p>Covers every resolution branch in priority order plus the segment safety rules.
 */
class FieldPathResolverTest {

    private final FieldPathResolver resolver = new FieldPathResolver();

    @ParameterizedTest
    @CsvSource({
            "product, product",
            "version, version",
            "type, type",
            "run_id, run_id",
            "runId, run_id",
            "actor.type, actor_type",
            "actor.id, actor_id",
            "actor.name, actor_name",
            "source.product, product",
            "source.version, version"
    })
    @DisplayName("Column-backed paths resolve to the bare column name")
    void columnPathsResolveToColumns(String path, String expected) {
        assertThat(resolver.resolvePath(path)).isEqualTo(expected);
    }

    @Test
    @DisplayName("Direct column wins over deeper segments")
    void directColumnIgnoresTrailingSegments() {
        ResolvedPath resolved = resolver.resolve("product.name");

        assertThat(resolved.getTarget()).isEqualTo(PathTarget.DIRECT_COLUMN);
        assertThat(resolved.toSql()).isEqualTo("product");
    }

    @Test
    @DisplayName("payload.model extracts from the payload column")
    void payloadPathExtractsFromPayload() {
        ResolvedPath resolved = resolver.resolve("payload.model");

        assertThat(resolved.getTarget()).isEqualTo(PathTarget.JSON_COLUMN);
        assertThat(resolved.isJson()).isTrue();
        assertThat(resolved.toSql()).isEqualTo("jsonb_path_query_first(payload, '$.model') #>> '{}'");
    }

    @Test
    @DisplayName("ctx paths keep every nested segment")
    void ctxPathKeepsNestedSegments() {
        assertThat(resolver.resolvePath("ctx.workspace.id"))
                .isEqualTo("jsonb_path_query_first(ctx, '$.workspace.id') #>> '{}'");
    }

    @Test
    @DisplayName("Bare payload addresses the whole document")
    void barePayloadAddressesWholeDocument() {
        assertThat(resolver.resolvePath("payload"))
                .isEqualTo("jsonb_path_query_first(payload, '$') #>> '{}'");
    }

    @Test
    @DisplayName("Unknown root falls back to a payload field with the full path")
    void unknownRootFallsBackToPayload() {
        ResolvedPath resolved = resolver.resolve("model");

        assertThat(resolved.getTarget()).isEqualTo(PathTarget.FALLBACK);
        assertThat(resolved.toSql()).isEqualTo("jsonb_path_query_first(payload, '$.model') #>> '{}'");
    }

    @Test
    @DisplayName("Unknown actor sub-field falls back to payload.actor.<field>")
    void unknownActorFieldFallsBack() {
        ResolvedPath resolved = resolver.resolve("actor.email");

        assertThat(resolved.getTarget()).isEqualTo(PathTarget.FALLBACK);
        assertThat(resolved.toSql()).isEqualTo("jsonb_path_query_first(payload, '$.actor.email') #>> '{}'");
    }

    @Test
    @DisplayName("Bare actor root is not a column")
    void bareActorFallsBack() {
        assertThat(resolver.resolve("actor").getTarget()).isEqualTo(PathTarget.FALLBACK);
        assertThat(resolver.resolve("source").getTarget()).isEqualTo(PathTarget.FALLBACK);
    }

    @Test
    @DisplayName("Segments outside identifier syntax are emitted as quoted members")
    void nonIdentifierSegmentsAreQuoted() {
        assertThat(resolver.resolvePath("ctx.session-id"))
                .isEqualTo("jsonb_path_query_first(ctx, '$.\"session-id\"') #>> '{}'");
    }

    @ParameterizedTest
    @ValueSource(strings = {"payload.a'b", "payload.x\"y", "ctx.a\\b", "mo'del", "payload.a\nb"})
    @DisplayName("Segments carrying quotes, backslashes or control characters are rejected")
    void unsafeSegmentsAreRejected(String path) {
        assertThatThrownBy(() -> resolver.resolve(path))
                .isInstanceOf(UnsafePathSegmentException.class)
                .hasFieldOrPropertyWithValue("path", path);
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "payload.", "payload..model", ".model", "ctx."})
    @DisplayName("Empty paths and empty segments are rejected")
    void emptySegmentsAreRejected(String path) {
        assertThatThrownBy(() -> resolver.resolve(path))
                .isInstanceOf(UnsafePathSegmentException.class)
                .hasFieldOrPropertyWithValue("segment", "");
    }

    @Test
    @DisplayName("Injection attempt through breakdown path never produces SQL")
    void injectionAttemptIsRejected() {
        assertThatThrownBy(() -> resolver.resolvePath("payload.x') OR 1=1 --"))
                .isInstanceOf(UnsafePathSegmentException.class);
    }

    @Test
    @DisplayName("Resolution is deterministic")
    void resolutionIsDeterministic() {
        assertThat(resolver.resolve("payload.model")).isEqualTo(resolver.resolve("payload.model"));
    }
}
