package com.syntex.quranstore.fetch;

import java.util.ArrayList;
import java.util.List;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.syntex.quranstore.db.model.ChapterRecord;
import com.syntex.quranstore.db.model.VerseKey;
import com.syntex.quranstore.db.model.VerseRecord;
import com.syntex.quranstore.db.model.WordRecord;

/**
 * Maps quran.com v4 JSON onto the store's record shapes.
 */
public class VersePayloadParser {

    private final String audioBaseUrl;

    public VersePayloadParser(String audioBaseUrl) {
        this.audioBaseUrl = audioBaseUrl;
    }

    public VerseRecord parseVerse(String json, VerseKey key) throws MalformedPayloadException {
        JsonObject root = root(json);
        JsonElement verseEl = root.get("verse");
        if (verseEl == null || !verseEl.isJsonObject()) {
            throw new MalformedPayloadException("Missing 'verse' object for " + key);
        }
        JsonObject verse = verseEl.getAsJsonObject();

        Integer remoteId = optInt(verse, "id");
        if (remoteId != null && remoteId != key.ayatId()) {
            throw new MalformedPayloadException("Verse " + key.verseKey() + " came back with id " + remoteId
                    + ", expected " + key.ayatId());
        }

        String text = optString(verse, "text_uthmani");
        if (text == null || text.isBlank()) {
            throw new MalformedPayloadException("Missing text_uthmani for " + key);
        }

        VerseRecord record = new VerseRecord();
        record.setAyatId(key.ayatId());
        record.setSuraId(orDefault(optInt(verse, "chapter_id"), key.suraId()));
        record.setAyatNumber(orDefault(optInt(verse, "verse_number"), key.ayatNumber()));
        record.setTextUthmani(text);
        record.setJuzId(requireInt(verse, "juz_number", key));
        Integer hizb = optInt(verse, "hizb_number");
        record.setHezbId(hizb != null ? hizb : requireInt(verse, "rub_el_hizb_number", key));
        record.setPageId(requireInt(verse, "page_number", key));
        record.setSajdahNumber(optInt(verse, "sajdah_number"));

        JsonElement audio = verse.get("audio");
        if (audio != null && audio.isJsonObject()) {
            JsonObject audioObj = audio.getAsJsonObject();
            record.setAudioUrl(combineUrl(optString(audioObj, "url")));
            JsonElement segments = audioObj.get("segments");
            if (segments != null && segments.isJsonArray() && segments.getAsJsonArray().size() > 0) {
                record.setAudioSegments(segments.toString());
            }
        }

        JsonElement words = verse.get("words");
        if (words == null || !words.isJsonArray()) {
            throw new MalformedPayloadException("Missing words array for " + key);
        }
        record.setWords(parseWords(words.getAsJsonArray(), key));
        return record;
    }

    private List<WordRecord> parseWords(JsonArray words, VerseKey key) throws MalformedPayloadException {
        List<WordRecord> out = new ArrayList<>();
        for (JsonElement el : words) {
            if (!el.isJsonObject()) {
                throw new MalformedPayloadException("Non-object word entry in " + key);
            }
            JsonObject w = el.getAsJsonObject();
            WordRecord word = new WordRecord();
            word.setWordId(requireInt(w, "id", key));
            word.setAyatId(key.ayatId());
            word.setWordNumber(requireInt(w, "position", key));
            word.setTextUthmani(orDefault(optString(w, "text_uthmani"), ""));

            String type = optString(w, "char_type_name");
            if (type == null) {
                type = optString(w, "char_type");
            }
            word.setType(orDefault(type, ""));
            word.setPageNumber(optInt(w, "page_number"));
            word.setLineNumber(optInt(w, "line_number"));

            String audio = optString(w, "audio_url");
            if (audio == null && w.has("audio") && w.get("audio").isJsonObject()) {
                audio = optString(w.getAsJsonObject("audio"), "url");
            }
            word.setAudioUrl(combineUrl(audio));
            out.add(word);
        }
        return out;
    }

    public List<ChapterRecord> parseChapters(String json) throws MalformedPayloadException {
        JsonObject root = root(json);
        if (!root.has("chapters") || !root.get("chapters").isJsonArray()) {
            throw new MalformedPayloadException("Missing 'chapters' array");
        }
        List<ChapterRecord> chapters = new ArrayList<>();
        for (JsonElement el : root.getAsJsonArray("chapters")) {
            if (!el.isJsonObject()) {
                throw new MalformedPayloadException("Non-object chapter entry: " + el);
            }
            JsonObject c = el.getAsJsonObject();
            Integer id = optInt(c, "id");
            Integer count = optInt(c, "verses_count");
            String name = optString(c, "name_arabic");
            if (id == null || count == null || name == null) {
                throw new MalformedPayloadException("Incomplete chapter entry: " + c);
            }
            chapters.add(new ChapterRecord(id, name, orDefault(optInt(c, "revelation_order"), 0), count));
        }
        return chapters;
    }

    /** Joins a relative audio path onto the audio host; absolute URLs pass through. */
    String combineUrl(String path) {
        if (path == null || path.isBlank()) {
            return null;
        }
        if (path.startsWith("http://") || path.startsWith("https://")) {
            return path;
        }
        if (path.startsWith("//")) {
            return "https:" + path;
        }
        String base = audioBaseUrl.endsWith("/") ? audioBaseUrl.substring(0, audioBaseUrl.length() - 1) : audioBaseUrl;
        String rel = path.startsWith("/") ? path.substring(1) : path;
        return base + "/" + rel;
    }

    private static JsonObject root(String json) throws MalformedPayloadException {
        try {
            JsonElement el = JsonParser.parseString(json);
            if (!el.isJsonObject()) {
                throw new MalformedPayloadException("Expected a JSON object, got " + el);
            }
            return el.getAsJsonObject();
        } catch (JsonParseException | IllegalStateException e) {
            throw new MalformedPayloadException("Unparseable JSON: " + e.getMessage(), e);
        }
    }

    private static int requireInt(JsonObject obj, String field, VerseKey key) throws MalformedPayloadException {
        Integer value = optInt(obj, field);
        if (value == null) {
            throw new MalformedPayloadException("Missing " + field + " for " + key);
        }
        return value;
    }

    private static Integer optInt(JsonObject obj, String field) {
        JsonElement el = obj.get(field);
        if (el == null || el.isJsonNull() || !el.isJsonPrimitive()) {
            return null;
        }
        try {
            return el.getAsInt();
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static String optString(JsonObject obj, String field) {
        JsonElement el = obj.get(field);
        return el != null && el.isJsonPrimitive() ? el.getAsString() : null;
    }

    private static <T> T orDefault(T value, T fallback) {
        return value != null ? value : fallback;
    }
}
