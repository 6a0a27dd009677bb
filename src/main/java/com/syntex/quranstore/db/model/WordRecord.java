package com.syntex.quranstore.db.model;

import lombok.Data;

@Data
public class WordRecord {

    private int wordId;
    private int ayatId;
    private int wordNumber;
    private String textUthmani;
    private String type; // "word", "end", "pause", ...
    private Integer pageNumber;
    private Integer lineNumber;
    private String audioUrl;
}
