package com.phillippitts.voicejukebox.exception;

import com.phillippitts.voicejukebox.domain.TrackRef;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;

class ExceptionHierarchyTest {

    @Test
    void baseExceptionKeepsMessageAndCause() {
        IOException cause = new IOException("socket closed");
        VoiceJukeboxException ex = new VoiceJukeboxException("wrapper", cause);

        assertThat(ex.getMessage()).isEqualTo("wrapper");
        assertThat(ex.getCause()).isSameAs(cause);
        assertThat(ex).isInstanceOf(RuntimeException.class);
    }

    @Test
    void sourceUnreachableNamesBackend() {
        SourceUnreachableException ex = new SourceUnreachableException("Connection refused", "navidrome");

        assertThat(ex.getMessage()).isEqualTo("Connection refused (backend: navidrome)");
        assertThat(ex.getBackend()).isEqualTo("navidrome");
        assertThat(ex).isInstanceOf(VoiceJukeboxException.class);
    }

    @Test
    void trackResolutionNamesTrackRef() {
        IOException cause = new IOException("404");
        TrackResolutionException ex = new TrackResolutionException("Unknown track id", new TrackRef("plex", "12"), cause);

        assertThat(ex.getMessage()).isEqualTo("Unknown track id (track: plex:12)");
        assertThat(ex.getRef()).isEqualTo(new TrackRef("plex", "12"));
        assertThat(ex.getCause()).isSameAs(cause);
    }

    @Test
    void populatorProtocolNamesJob() {
        PopulatorProtocolException ex = new PopulatorProtocolException("Queue rejected append", "populator-4");

        assertThat(ex.getMessage()).contains("(job: populator-4)");
        assertThat(ex.getJobId()).isEqualTo("populator-4");
    }

    @Test
    void invalidQueueOperationIsApplicationException() {
        assertThat(new InvalidQueueOperationException("bad index")).isInstanceOf(VoiceJukeboxException.class);
    }
}
