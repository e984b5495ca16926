package com.phillippitts.voicejukebox.domain;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TrackTest {

    @Test
    void missingOptionalTextBecomesEmpty() {
        Track t = new Track("1", "Heroes", null, null, null, 0, null, null, "plex", 0);

        assertThat(t.artist()).isEmpty();
        assertThat(t.album()).isEmpty();
        assertThat(t.genre()).isEmpty();
    }

    @Test
    void blankIdIsRejected() {
        assertThatThrownBy(() -> new Track(" ", "Heroes", "", "", "", 0, null, null, "plex", 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void negativeNumbersAreRejected() {
        assertThatThrownBy(() -> new Track("1", "Heroes", "", "", "", -1, null, null, "plex", 0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new Track("1", "Heroes", "", "", "", 0, null, null, "plex", -320))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void refAndStreamLocatorCopy() {
        Track t = new Track("12", "Heroes", "David Bowie", "", "", 371, null, null, "plex", 256);

        Track withUrl = t.withStreamLocator("http://plex/12");

        assertThat(t.ref()).isEqualTo(new TrackRef("plex", "12"));
        assertThat(t.ref().toString()).isEqualTo("plex:12");
        assertThat(withUrl.streamLocator()).isEqualTo("http://plex/12");
        assertThat(withUrl.bitrateKbps()).isEqualTo(256);
        assertThat(t.streamLocator()).isNull();
    }

    @Test
    void queueEntryOffsetCannotBeNegative() {
        Track t = new Track("1", "Heroes", "", "", "", 0, null, null, "plex", 0);

        assertThat(QueueEntry.of(t).offsetMs()).isZero();
        assertThatThrownBy(() -> new QueueEntry(t, -1)).isInstanceOf(IllegalArgumentException.class);
    }
}
