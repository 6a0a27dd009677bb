package com.syntex.quranstore.enrich;

/**
 * A structural group whose derived columns could not be computed and were left
 * as they were.
 */
public record GroupFailure(String group, int id, String reason) {

    @Override
    public String toString() {
        return group + " " + id + ": " + reason;
    }
}
