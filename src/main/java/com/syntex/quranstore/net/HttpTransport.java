package com.syntex.quranstore.net;

import java.io.IOException;

/**
 * A single network exchange, no retries. Any HTTP status is a normal return;
 * only connection-level problems throw.
 */
@FunctionalInterface
public interface HttpTransport {

    RawResponse execute(FetchRequest request) throws IOException;
}
