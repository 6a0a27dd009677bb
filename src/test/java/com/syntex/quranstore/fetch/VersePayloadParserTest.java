package com.syntex.quranstore.fetch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.syntex.quranstore.db.model.ChapterRecord;
import com.syntex.quranstore.db.model.VerseKey;
import com.syntex.quranstore.db.model.VerseRecord;
import com.syntex.quranstore.db.model.WordRecord;

class VersePayloadParserTest {

    private static final VerseKey FIRST = new VerseKey(1, 1, 1);

    private final VersePayloadParser parser = new VersePayloadParser("https://verses.quran.foundation/");

    @Test
    void parsesVerseFieldsAndAudio() throws Exception {
        VerseRecord verse = parser.parseVerse(Fixtures.read("verse_1_1.json"), FIRST);

        assertThat(verse.getAyatId()).isEqualTo(1);
        assertThat(verse.getSuraId()).isEqualTo(1);
        assertThat(verse.getAyatNumber()).isEqualTo(1);
        assertThat(verse.getJuzId()).isEqualTo(1);
        assertThat(verse.getHezbId()).isEqualTo(1);
        assertThat(verse.getPageId()).isEqualTo(1);
        assertThat(verse.getSajdahNumber()).isNull();
        assertThat(verse.getTextUthmani()).startsWith("بِسْمِ");
        assertThat(verse.getAudioUrl()).isEqualTo("https://verses.quran.foundation/AbdulBaset/Mujawwad/mp3/001001.mp3");
        assertThat(verse.getAudioSegments()).isEqualTo("[[0,1,0,630],[1,2,650,1200]]");
    }

    @Test
    void parsesWordsInPayloadOrder() throws Exception {
        List<WordRecord> words = parser.parseVerse(Fixtures.read("verse_1_1.json"), FIRST).getWords();

        assertThat(words).hasSize(5);
        assertThat(words).extracting(WordRecord::getWordNumber).containsExactly(1, 2, 3, 4, 5);
        assertThat(words).allSatisfy(w -> {
            assertThat(w.getAyatId()).isEqualTo(1);
            assertThat(w.getPageNumber()).isEqualTo(1);
            assertThat(w.getLineNumber()).isEqualTo(2);
        });

        WordRecord first = words.get(0);
        assertThat(first.getWordId()).isEqualTo(1);
        assertThat(first.getType()).isEqualTo("word");
        assertThat(first.getAudioUrl()).isEqualTo("https://verses.quran.foundation/wbw/001_001_001.mp3");

        WordRecord marker = words.get(4);
        assertThat(marker.getType()).isEqualTo("end");
        assertThat(marker.getAudioUrl()).isNull();
    }

    @Test
    void rejectsPayloadWhoseIdDisagreesWithKey() {
        String json = Fixtures.read("verse_1_1.json");

        assertThatThrownBy(() -> parser.parseVerse(json, new VerseKey(2, 1, 2)))
                .isInstanceOf(MalformedPayloadException.class)
                .hasMessageContaining("expected 2");
    }

    @Test
    void rejectsMissingRequiredFields() {
        String noPage = Fixtures.read("verse_1_1.json").replace("\"page_number\": 1,\n    \"juz_number\"", "\"juz_number\"");

        assertThatThrownBy(() -> parser.parseVerse(noPage, FIRST))
                .isInstanceOf(MalformedPayloadException.class)
                .hasMessageContaining("page_number");
        assertThatThrownBy(() -> parser.parseVerse("{\"verse\": {\"id\": 1}}", FIRST))
                .isInstanceOf(MalformedPayloadException.class)
                .hasMessageContaining("text_uthmani");
        assertThatThrownBy(() -> parser.parseVerse("{\"verses\": []}", FIRST))
                .isInstanceOf(MalformedPayloadException.class);
    }

    @Test
    void rejectsTruncatedJson() {
        assertThatThrownBy(() -> parser.parseVerse("{\"verse\": {\"id\": 1, \"text_", FIRST))
                .isInstanceOf(MalformedPayloadException.class)
                .hasMessageContaining("Unparseable");
        assertThatThrownBy(() -> parser.parseVerse("[1, 2]", FIRST))
                .isInstanceOf(MalformedPayloadException.class);
    }

    @Test
    void fallsBackToRubAndKeyWhenOptionalFieldsAreAbsent() throws Exception {
        String json = """
            {"verse": {"id": 8, "text_uthmani": "الم", "rub_el_hizb_number": 1, "page_number": 2,
                       "juz_number": 1, "sajdah_number": 3,
                       "words": [{"id": 30, "position": 1, "char_type": "word", "audio": {"url": "//cdn.example/w.mp3"}}]}}
            """;

        VerseRecord verse = parser.parseVerse(json, new VerseKey(8, 2, 1));

        assertThat(verse.getSuraId()).isEqualTo(2);
        assertThat(verse.getAyatNumber()).isEqualTo(1);
        assertThat(verse.getHezbId()).isEqualTo(1);
        assertThat(verse.getSajdahNumber()).isEqualTo(3);
        assertThat(verse.getAudioUrl()).isNull();
        assertThat(verse.getWords().get(0).getType()).isEqualTo("word");
        assertThat(verse.getWords().get(0).getAudioUrl()).isEqualTo("https://cdn.example/w.mp3");
        assertThat(verse.getWords().get(0).getPageNumber()).isNull();
    }

    @Test
    void combinesAudioPaths() {
        assertThat(parser.combineUrl("/a/b.mp3")).isEqualTo("https://verses.quran.foundation/a/b.mp3");
        assertThat(parser.combineUrl("http://other/x.mp3")).isEqualTo("http://other/x.mp3");
        assertThat(parser.combineUrl("  ")).isNull();
    }

    @Test
    void parsesChapters() throws Exception {
        List<ChapterRecord> chapters = parser.parseChapters(Fixtures.read("chapters.json"));

        assertThat(chapters).containsExactly(
                new ChapterRecord(1, "الفاتحة", 5, 7),
                new ChapterRecord(2, "البقرة", 87, 286));
    }

    @Test
    void rejectsIncompleteChapter() {
        assertThatThrownBy(() -> parser.parseChapters("{\"chapters\": [{\"id\": 1}]}"))
                .isInstanceOf(MalformedPayloadException.class);
    }
}
