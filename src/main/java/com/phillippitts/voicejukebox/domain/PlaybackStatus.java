package com.phillippitts.voicejukebox.domain;

/** Play state reported to the directive builder. */
public enum PlaybackStatus { PLAYING, PAUSED, STOPPED }
