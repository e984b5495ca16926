/**
 * Parallel fan-out of a query to every enabled backend, with a shared timeout and partial-failure results.
 */
package com.phillippitts.voicejukebox.service.resolve;
