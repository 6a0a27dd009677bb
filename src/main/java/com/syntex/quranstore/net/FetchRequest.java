package com.syntex.quranstore.net;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

public record FetchRequest(String url, String method, Map<String, String> headers, Duration timeout) {

    public FetchRequest {
        headers = Map.copyOf(headers);
    }

    public static FetchRequest get(String url, Duration timeout) {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("Accept", "application/json");
        return new FetchRequest(url, "GET", headers, timeout);
    }
}
