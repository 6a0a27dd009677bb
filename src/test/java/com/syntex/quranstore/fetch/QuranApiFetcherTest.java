package com.syntex.quranstore.fetch;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.syntex.quranstore.db.model.ChapterRecord;
import com.syntex.quranstore.db.model.VerseKey;
import com.syntex.quranstore.db.model.VerseRecord;
import com.syntex.quranstore.net.FailureKind;
import com.syntex.quranstore.net.FetchRequest;
import com.syntex.quranstore.net.FetchResult;
import com.syntex.quranstore.net.HttpTransport;
import com.syntex.quranstore.net.RawResponse;
import com.syntex.quranstore.net.RetryClient;
import com.syntex.quranstore.net.RetrySettings;

class QuranApiFetcherTest {

    private final List<FetchRequest> requests = new ArrayList<>();

    private QuranApiFetcher fetcher(HttpTransport transport, int attempts) {
        HttpTransport recording = request -> {
            requests.add(request);
            return transport.execute(request);
        };
        RetryClient client = new RetryClient(recording, new RetrySettings(attempts, 1, 10, 0.0), millis -> { });
        return new QuranApiFetcher(client, "https://api.quran.com/api/v4/", "https://verses.quran.foundation/", 7,
                Duration.ofSeconds(30));
    }

    private static RawResponse ok(String body) {
        return RawResponse.of(200, body.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void fetchesAndParsesOneVerse() {
        QuranApiFetcher fetcher = fetcher(request -> ok(Fixtures.read("verse_1_1.json")), 3);

        FetchResult<VerseRecord> result = fetcher.fetchUnit(new VerseKey(1, 1, 1));

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.attempts()).isEqualTo(1);
        assertThat(result.value().getWords()).hasSize(5);
        assertThat(requests).singleElement().satisfies(r -> {
            assertThat(r.method()).isEqualTo("GET");
            assertThat(r.timeout()).isEqualTo(Duration.ofSeconds(30));
            assertThat(r.url()).startsWith("https://api.quran.com/api/v4/verses/by_key/1:1?words=true&audio=7");
            assertThat(r.url()).contains("word_fields=").contains("fields=");
        });
    }

    @Test
    void malformedBodyIsPermanentAndNotRetried() {
        QuranApiFetcher fetcher = fetcher(request -> ok("<html>maintenance</html>"), 5);

        FetchResult<VerseRecord> result = fetcher.fetchUnit(new VerseKey(1, 1, 1));

        assertThat(result.failure().kind()).isEqualTo(FailureKind.PERMANENT);
        assertThat(result.failure().attempts()).isEqualTo(1);
        assertThat(requests).hasSize(1);
    }

    @Test
    void serverErrorsSurfaceAfterRetries() {
        QuranApiFetcher fetcher = fetcher(request -> RawResponse.of(502, null), 2);

        FetchResult<VerseRecord> result = fetcher.fetchUnit(new VerseKey(9, 2, 2));

        assertThat(result.failure().kind()).isEqualTo(FailureKind.SERVER_ERROR);
        assertThat(result.failure().attempts()).isEqualTo(2);
        assertThat(requests).extracting(FetchRequest::url).allMatch(u -> u.contains("/verses/by_key/2:2?"));
    }

    @Test
    void fetchesChapterList() {
        QuranApiFetcher fetcher = fetcher(request -> ok(Fixtures.read("chapters.json")), 3);

        FetchResult<List<ChapterRecord>> result = fetcher.fetchChapters();

        assertThat(result.value()).extracting(ChapterRecord::getAyatCount).containsExactly(7, 286);
        assertThat(requests.get(0).url()).isEqualTo("https://api.quran.com/api/v4/chapters?language=ar");
    }
}
