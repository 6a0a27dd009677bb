package com.syntex.quranstore.ingest;

public record IngestOptions(RefreshMode refreshMode, int workers, int progressEvery) {

    public IngestOptions {
        if (workers < 1) {
            throw new IllegalArgumentException("workers must be >= 1, got " + workers);
        }
        if (progressEvery < 1) {
            throw new IllegalArgumentException("progressEvery must be >= 1, got " + progressEvery);
        }
    }

    public static IngestOptions defaults() {
        return new IngestOptions(RefreshMode.FILL_MISSING, 1, 250);
    }
}
