package com.syntex.quranstore.ingest;

public enum RefreshMode {
    /** Re-fetch and re-write every unit. */
    FORCE_REFRESH,
    /** Skip units already complete in the store. */
    FILL_MISSING
}
