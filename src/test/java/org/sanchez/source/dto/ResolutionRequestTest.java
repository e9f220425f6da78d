package org.sanchez.source.dto;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResolutionRequestTest {

    @Test
    void constructor_rejectsBlankSourcePath() {
        assertThatThrownBy(() -> new ResolutionRequest("  ", "out", false))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("sourcePath");
        assertThatThrownBy(() -> new ResolutionRequest(null, "out", true))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void constructor_requiresOutputPathInBatchMode() {
        assertThatThrownBy(() -> new ResolutionRequest("source", null, true))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("outputPath");
    }

    @Test
    void constructor_allowsMissingOutputPathInSingleMode() {
        ResolutionRequest request = new ResolutionRequest("photo.jpg", null, false);

        assertThat(request.outputPath()).isNull();
        assertThat(request.batch()).isFalse();
    }
}
