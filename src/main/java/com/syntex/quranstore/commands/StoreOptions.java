package com.syntex.quranstore.commands;

import picocli.CommandLine;

/**
 * Options shared by every command that opens the store.
 */
public class StoreOptions {

    @CommandLine.Option(
            names = {"--db"},
            paramLabel = "URL_OR_PATH",
            description = "SQLite file or JDBC URL (default: db.url from config / QURAN_DB_URL)"
    )
    String db;
}
