package com.meetlink.backend.modules.provider.infrastructure.daily;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import com.meetlink.backend.modules.provider.application.VideoProviderException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Turns a non-2xx Daily response into a {@link VideoProviderException}.
 * Daily answers errors as {@code {"error": "...", "info": "..."}}.
 */
final class DailyApiErrorDecoder {

    private static final int MAX_FALLBACK_LENGTH = 200;

    private DailyApiErrorDecoder() {
    }

    static VideoProviderException decode(ObjectMapper mapper, int statusCode, InputStream bodyStream) throws IOException {
        if (bodyStream == null) {
            return new VideoProviderException(statusCode, null, "Provider responded with HTTP " + statusCode);
        }

        byte[] bytes = bodyStream.readAllBytes();
        if (bytes.length == 0) {
            return new VideoProviderException(statusCode, null, "Provider responded with HTTP " + statusCode);
        }

        try {
            JsonNode node = mapper.readTree(bytes);
            String code = node.hasNonNull("error") ? node.get("error").asText() : null;
            String info = node.hasNonNull("info") ? node.get("info").asText() : null;
            return new VideoProviderException(statusCode, code, info != null ? info : "Provider responded with HTTP " + statusCode);
        } catch (IOException ex) {
            String fallback = new String(bytes, StandardCharsets.UTF_8);
            if (fallback.length() > MAX_FALLBACK_LENGTH) {
                fallback = fallback.substring(0, MAX_FALLBACK_LENGTH);
            }
            return new VideoProviderException(statusCode, null, fallback);
        }
    }
}
