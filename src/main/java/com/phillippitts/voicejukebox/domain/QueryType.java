package com.phillippitts.voicejukebox.domain;

/**
 * Kind of voice query; decides which track field the free text is matched against.
 */
public enum QueryType {
    ARTIST,
    ALBUM,
    TRACK,
    GENRE,
    PLAYLIST
}
