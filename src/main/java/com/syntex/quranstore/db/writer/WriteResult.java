package com.syntex.quranstore.db.writer;

public record WriteResult(int rowsWritten, WriteFailure failure) {

    public static WriteResult ok(int rowsWritten) {
        return new WriteResult(rowsWritten, null);
    }

    public static WriteResult failed(WriteFailure failure) {
        return new WriteResult(0, failure);
    }

    public boolean isSuccess() {
        return failure == null;
    }
}
