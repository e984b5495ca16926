package com.phillippitts.voicejukebox.service.resolve;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ResolutionResultTest {

    @Test
    void noEnabledBackendCountsAsUnreachable() {
        ResolutionResult result = new ResolutionResult(List.of(), List.of(), Map.of());

        assertThat(result.allSourcesUnreachable()).isTrue();
    }

    @Test
    void partialFailureIsNotUnreachable() {
        ResolutionResult result = new ResolutionResult(List.of(), List.of("a", "b"), Map.of("a", "timeout"));

        assertThat(result.allSourcesUnreachable()).isFalse();
        assertThat(result.isPartial()).isTrue();
    }

    @Test
    void nullCollectionsBecomeEmpty() {
        ResolutionResult result = new ResolutionResult(null, null, null);

        assertThat(result.candidates()).isEmpty();
        assertThat(result.failedBackends()).isEmpty();
    }
}
