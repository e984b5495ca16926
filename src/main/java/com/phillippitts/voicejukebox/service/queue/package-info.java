/**
 * The shared playback queue, its navigation results and the write leases that fence background writers.
 *
 * @see com.phillippitts.voicejukebox.service.queue.PlaybackQueue
 */
package com.phillippitts.voicejukebox.service.queue;
