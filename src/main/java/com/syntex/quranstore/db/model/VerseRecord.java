package com.syntex.quranstore.db.model;

import java.util.ArrayList;
import java.util.List;

import lombok.Data;

@Data
public class VerseRecord {

    private int ayatId;
    private int suraId;
    private int ayatNumber;
    private String textUthmani;
    private int juzId;
    private int hezbId;
    private int pageId;
    private Integer sajdahNumber;
    private String audioUrl;
    private String audioSegments; // raw JSON array, stored as-is
    private List<WordRecord> words = new ArrayList<>();
}
