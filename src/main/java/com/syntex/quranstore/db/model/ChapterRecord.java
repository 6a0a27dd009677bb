package com.syntex.quranstore.db.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ChapterRecord {

    private int suraId;
    private String nameArabic;
    private int revelationOrder;
    private int ayatCount;
}
