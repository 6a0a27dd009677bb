package com.syntex.quranstore.net;

import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Status, headers and body of one HTTP exchange. Header lookup is
 * case-insensitive.
 */
public record RawResponse(int status, Map<String, String> headers, byte[] body) {

    public RawResponse {
        Map<String, String> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (headers != null) {
            headers.forEach((k, v) -> {
                if (k != null) {
                    copy.put(k.toLowerCase(Locale.ROOT), v);
                }
            });
        }
        headers = copy;
        body = body == null ? new byte[0] : body;
    }

    public static RawResponse of(int status, byte[] body) {
        return new RawResponse(status, Map.of(), body);
    }

    public String header(String name) {
        return headers.get(name);
    }

    public boolean isSuccessful() {
        return status >= 200 && status < 300;
    }
}
