package org.transitscope.pipeline.orchestrator;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class StageResultTest {

    @Test
    void successfulStageKeepsItsOutput() {
        List<StageError> errors = new ArrayList<>();

        StageResult<List<String>> result = StageResult.attempt(PipelineStage.RESOLVING_LINES, () -> List.of("line"));

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.orDefault(List::of, errors::add)).containsExactly("line");
        assertThat(errors).isEmpty();
    }

    @Test
    void failedStageYieldsDefaultAndReportsError() {
        List<StageError> errors = new ArrayList<>();

        StageResult<List<String>> result = StageResult.attempt(PipelineStage.BUILDING_PATHS, () -> {
            throw new IllegalArgumentException("bad stop");
        });

        assertThat(result.orDefault(List::of, errors::add)).isEmpty();
        assertThat(errors).singleElement().satisfies(error -> {
            assertThat(error.stage()).isEqualTo(PipelineStage.BUILDING_PATHS);
            assertThat(error.message()).isEqualTo("IllegalArgumentException: bad stop");
        });
    }

    @Test
    void nullOutputFallsBackWithoutError() {
        List<StageError> errors = new ArrayList<>();

        String value = StageResult.<String>attempt(PipelineStage.COMPUTING_STATS, () -> null)
                .orDefault(() -> "default", errors::add);

        assertThat(value).isEqualTo("default");
        assertThat(errors).isEmpty();
    }
}
