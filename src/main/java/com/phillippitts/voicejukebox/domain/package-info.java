/**
 * Immutable domain types shared by the resolver, ranking engine, playback queue and populator.
 *
 * <p>{@link com.phillippitts.voicejukebox.domain.Track} is the normalized unit of playback;
 * {@link com.phillippitts.voicejukebox.domain.QueueEntry} adds the per-entry resume offset.
 *
 * @since 1.0
 */
package com.phillippitts.voicejukebox.domain;
