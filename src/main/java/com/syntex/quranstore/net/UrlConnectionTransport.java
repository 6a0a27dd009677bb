package com.syntex.quranstore.net;

import java.io.IOException;
import java.io.InputStream;
import java.net.HttpURLConnection;
import java.net.URL;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

public class UrlConnectionTransport implements HttpTransport {

    private final String userAgent;

    public UrlConnectionTransport(String userAgent) {
        this.userAgent = userAgent;
    }

    @Override
    public RawResponse execute(FetchRequest request) throws IOException {
        HttpURLConnection conn = (HttpURLConnection) new URL(request.url()).openConnection();
        try {
            int timeout = (int) Math.min(Integer.MAX_VALUE, request.timeout().toMillis());
            conn.setConnectTimeout(timeout);
            conn.setReadTimeout(timeout);
            conn.setRequestMethod(request.method());
            conn.setRequestProperty("User-Agent", userAgent);
            request.headers().forEach(conn::setRequestProperty);
            conn.connect();

            int status = conn.getResponseCode();
            Map<String, String> headers = new HashMap<>();
            for (Map.Entry<String, List<String>> entry : conn.getHeaderFields().entrySet()) {
                if (entry.getKey() != null && !entry.getValue().isEmpty()) {
                    headers.put(entry.getKey(), entry.getValue().get(0));
                }
            }

            byte[] body;
            try (InputStream in = status >= 400 ? conn.getErrorStream() : conn.getInputStream()) {
                body = in == null ? new byte[0] : in.readAllBytes();
            }
            return new RawResponse(status, headers, body);
        } finally {
            conn.disconnect();
        }
    }
}
