package com.syntex.quranstore.fetch;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;

import com.syntex.quranstore.db.model.ChapterRecord;
import com.syntex.quranstore.db.model.VerseKey;
import com.syntex.quranstore.db.model.VerseRecord;
import com.syntex.quranstore.net.FetchFailure;
import com.syntex.quranstore.net.FetchRequest;
import com.syntex.quranstore.net.FetchResult;
import com.syntex.quranstore.net.RetryClient;

/**
 * quran.com v4 client. One request per verse, words and recitation audio
 * included.
 */
public class QuranApiFetcher implements ResourceFetcher {

    static final String VERSE_FIELDS = "text_uthmani,chapter_id,page_number,juz_number,hizb_number,sajdah_number";
    static final String WORD_FIELDS = "text_uthmani,page_number,line_number,char_type,audio";

    private final RetryClient client;
    private final VersePayloadParser parser;
    private final String apiBaseUrl;
    private final int reciterId;
    private final Duration timeout;

    public QuranApiFetcher(RetryClient client, String apiBaseUrl, String audioBaseUrl, int reciterId, Duration timeout) {
        this.client = client;
        this.parser = new VersePayloadParser(audioBaseUrl);
        this.apiBaseUrl = apiBaseUrl.endsWith("/") ? apiBaseUrl.substring(0, apiBaseUrl.length() - 1) : apiBaseUrl;
        this.reciterId = reciterId;
        this.timeout = timeout;
    }

    @Override
    public FetchResult<VerseRecord> fetchUnit(VerseKey key) {
        FetchResult<byte[]> raw = client.fetch(FetchRequest.get(verseUrl(key), timeout));
        if (!raw.isSuccess()) {
            return FetchResult.failure(raw.failure());
        }
        try {
            String json = new String(raw.value(), StandardCharsets.UTF_8);
            return FetchResult.success(parser.parseVerse(json, key), raw.attempts());
        } catch (MalformedPayloadException e) {
            return FetchResult.failure(FetchFailure.permanent(raw.attempts(), e.getMessage()));
        }
    }

    public FetchResult<List<ChapterRecord>> fetchChapters() {
        FetchResult<byte[]> raw = client.fetch(FetchRequest.get(apiBaseUrl + "/chapters?language=ar", timeout));
        if (!raw.isSuccess()) {
            return FetchResult.failure(raw.failure());
        }
        try {
            return FetchResult.success(parser.parseChapters(new String(raw.value(), StandardCharsets.UTF_8)),
                    raw.attempts());
        } catch (MalformedPayloadException e) {
            return FetchResult.failure(FetchFailure.permanent(raw.attempts(), e.getMessage()));
        }
    }

    String verseUrl(VerseKey key) {
        return apiBaseUrl + "/verses/by_key/" + key.verseKey()
                + "?words=true&audio=" + reciterId
                + "&word_fields=" + WORD_FIELDS
                + "&fields=" + VERSE_FIELDS;
    }
}
