package com.syntex.quranstore.commands;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Shutdown hook that cancels a running job and holds the JVM until the job
 * reports it has stopped, or the grace period runs out. Closing it marks the
 * job finished and unregisters the hook.
 */
final class CancelOnShutdown implements AutoCloseable {

    private final Runnable cancel;
    private final long graceMillis;
    private final CountDownLatch finished = new CountDownLatch(1);
    private final Thread hook;

    CancelOnShutdown(Runnable cancel, long graceMillis) {
        this.cancel = cancel;
        this.graceMillis = graceMillis;
        this.hook = new Thread(this::onShutdown, "ingest-cancel");
    }

    static CancelOnShutdown install(Runnable cancel, long graceMillis) {
        CancelOnShutdown shutdown = new CancelOnShutdown(cancel, graceMillis);
        Runtime.getRuntime().addShutdownHook(shutdown.hook);
        return shutdown;
    }

    void onShutdown() {
        cancel.run();
        try {
            if (!finished.await(graceMillis, TimeUnit.MILLISECONDS)) {
                System.err.println("⚠ Ingestion did not stop within " + graceMillis + "ms, exiting anyway");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        finished.countDown();
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException shuttingDown) {
            System.err.println("⚠ Shutdown in progress, ingestion stopped after the current unit");
        }
    }
}
