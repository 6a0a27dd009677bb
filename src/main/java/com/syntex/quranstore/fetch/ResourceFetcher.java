package com.syntex.quranstore.fetch;

import com.syntex.quranstore.db.model.VerseKey;
import com.syntex.quranstore.db.model.VerseRecord;
import com.syntex.quranstore.net.FetchResult;

/**
 * Pulls one verse from the remote source. Never writes to the store and never
 * throws: parse and transport problems come back as failures.
 */
@FunctionalInterface
public interface ResourceFetcher {

    FetchResult<VerseRecord> fetchUnit(VerseKey key);
}
