package com.syntex.quranstore.ingest;

/**
 * Ingestion was started before Suras, Juzs, Hezbs and Pages were seeded.
 */
public class StoreNotSeededException extends IllegalStateException {

    public StoreNotSeededException(String message) {
        super(message);
    }
}
