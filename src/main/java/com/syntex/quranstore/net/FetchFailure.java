package com.syntex.quranstore.net;

public record FetchFailure(FailureKind kind, int attempts, String lastError) {

    public static FetchFailure permanent(int attempts, String lastError) {
        return new FetchFailure(FailureKind.PERMANENT, attempts, lastError);
    }

    @Override
    public String toString() {
        return kind + " after " + attempts + " attempt(s): " + lastError;
    }
}
