package com.phillippitts.voicejukebox.service.events;

import com.phillippitts.voicejukebox.service.populator.PopulatorState;
import com.phillippitts.voicejukebox.service.populator.event.PopulatorFinishedEvent;
import com.phillippitts.voicejukebox.service.resolve.event.SourceUnreachableEvent;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class ResolutionEventsListenerTest {

    @Test
    void throttlesRepeatedKeys() {
        ResolutionEventsListener listener = new ResolutionEventsListener();

        assertThat(listener.shouldLog("source-plex-timeout")).isTrue();
        assertThat(listener.shouldLog("source-plex-timeout")).isFalse();
        assertThat(listener.shouldLog("source-nav-timeout")).isTrue();
    }

    @Test
    void sourceUnreachableUsesBackendAndReasonAsThrottleKey() {
        ResolutionEventsListener listener = new ResolutionEventsListener();

        listener.onSourceUnreachable(new SourceUnreachableEvent("plex", "timeout", null));

        assertThat(listener.shouldLog("source-plex-timeout")).isFalse();
        assertThat(listener.shouldLog("source-plex-unreachable")).isTrue();
    }

    @Test
    void failedPopulatorIsThrottledPerOrigin() {
        ResolutionEventsListener listener = new ResolutionEventsListener();

        listener.onPopulatorFinished(new PopulatorFinishedEvent("populator-3", "nav", PopulatorState.FAILED,
                4, 0, 4, null));

        assertThat(listener.shouldLog("populator-failed-nav")).isFalse();
    }

    @Test
    void completedAndAbortedPopulatorsAreHandled() {
        ResolutionEventsListener listener = new ResolutionEventsListener();

        assertThatCode(() -> {
            listener.onPopulatorFinished(new PopulatorFinishedEvent("populator-1", "nav", PopulatorState.COMPLETED,
                    3, 3, 0, null));
            listener.onPopulatorFinished(new PopulatorFinishedEvent("populator-2", "nav", PopulatorState.ABORTED,
                    3, 1, 0, null));
        }).doesNotThrowAnyException();
    }
}
