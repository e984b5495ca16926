/**
 * Background population of the playback queue.
 *
 * <p>{@link com.phillippitts.voicejukebox.service.populator.SessionSupervisor} keeps at most one live
 * {@link com.phillippitts.voicejukebox.service.populator.PopulatorJob}. A job resolves its pending track
 * identifiers one at a time and appends them under a queue write lease; revoking the lease fences the
 * job even if it ignores cancellation.
 */
package com.phillippitts.voicejukebox.service.populator;
