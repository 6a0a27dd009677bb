package com.syntex.quranstore.db.model;

/**
 * Address of one verse: its global id plus the chapter:verse pair the remote
 * API is keyed by.
 */
public record VerseKey(int ayatId, int suraId, int ayatNumber) implements Comparable<VerseKey> {

    public String verseKey() {
        return suraId + ":" + ayatNumber;
    }

    @Override
    public int compareTo(VerseKey other) {
        return Integer.compare(ayatId, other.ayatId);
    }

    @Override
    public String toString() {
        return verseKey() + " (#" + ayatId + ")";
    }
}
