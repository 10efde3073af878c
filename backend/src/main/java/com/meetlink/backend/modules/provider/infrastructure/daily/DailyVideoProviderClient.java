package com.meetlink.backend.modules.provider.infrastructure.daily;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

import com.meetlink.backend.modules.provider.application.VideoProviderClient;
import com.meetlink.backend.modules.provider.application.VideoProviderException;
import com.meetlink.backend.modules.provider.domain.ProviderRoom;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Daily.co REST adapter: {@code POST /rooms}, {@code DELETE /rooms/{name}}, {@code POST /meeting-tokens}.
 */
public class DailyVideoProviderClient implements VideoProviderClient {

    private static final Logger log = LoggerFactory.getLogger(DailyVideoProviderClient.class);
    private static final Pattern ROOM_NAME = Pattern.compile("[A-Za-z0-9_-]{1,128}");

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String baseUrl;
    private final String apiKey;
    private final Duration requestTimeout;
    private final int createAttempts;
    private final Clock clock;

    public DailyVideoProviderClient(
            HttpClient httpClient,
            ObjectMapper objectMapper,
            String baseUrl,
            String apiKey,
            Duration requestTimeout,
            int createAttempts,
            Clock clock
    ) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.apiKey = apiKey;
        this.requestTimeout = requestTimeout;
        this.createAttempts = Math.max(1, createAttempts);
        this.clock = clock;
    }

    @Override
    public ProviderRoom createRoom(String name, OffsetDateTime expiresAt, int maxParticipants) {
        requireRoomName(name);
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put("exp", expiresAt.toEpochSecond());
        properties.put("max_participants", maxParticipants);
        properties.put("enable_screenshare", true);
        properties.put("enable_chat", true);
        properties.put("enable_prejoin_ui", true);
        properties.put("enable_network_ui", true);
        properties.put("eject_at_room_exp", true);
        Map<String, Object> payload = Map.of("name", name, "properties", properties);

        VideoProviderException last = null;
        for (int attempt = 1; attempt <= createAttempts; attempt++) {
            try {
                JsonNode room = send("POST", "/rooms", payload);
                String roomName = room.path("name").asText(name);
                String roomUrl = room.path("url").asText(null);
                return new ProviderRoom(roomName, roomUrl);
            } catch (VideoProviderException ex) {
                last = ex;
                if (!ex.isRetryable() || attempt == createAttempts || Thread.currentThread().isInterrupted()) {
                    break;
                }
                log.warn("Room creation attempt {}/{} failed for {}: {}", attempt, createAttempts, name, ex.getMessage());
            }
        }
        throw last;
    }

    @Override
    public void deleteRoom(String name) {
        requireRoomName(name);
        try {
            send("DELETE", "/rooms/" + name, null);
        } catch (VideoProviderException ex) {
            if (ex.getStatusCode() == 404) {
                log.debug("Room {} already gone on provider side", name);
                return;
            }
            throw ex;
        }
    }

    @Override
    public String mintParticipantToken(String roomName, String participantName, Duration ttl) {
        requireRoomName(roomName);
        long exp = clock.instant().plus(ttl).getEpochSecond();
        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put("room_name", roomName);
        properties.put("user_name", participantName);
        properties.put("exp", exp);
        properties.put("eject_at_token_exp", true);
        properties.put("enable_screenshare", true);

        JsonNode response = send("POST", "/meeting-tokens", Map.of("properties", properties));
        String token = response.path("token").asText(null);
        if (token == null || token.isBlank()) {
            throw new VideoProviderException(200, "missing_token", "Provider returned no participant token");
        }
        return token;
    }

    private JsonNode send(String method, String path, Object payload) {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .timeout(requestTimeout)
                .header("Authorization", "Bearer " + apiKey)
                .header("Accept", "application/json");

        try {
            if (payload == null) {
                builder.method(method, HttpRequest.BodyPublishers.noBody());
            } else {
                byte[] body = objectMapper.writeValueAsBytes(payload);
                builder.method(method, HttpRequest.BodyPublishers.ofByteArray(body));
                builder.header("Content-Type", "application/json");
            }

            HttpResponse<InputStream> response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofInputStream());
            try (InputStream body = response.body()) {
                int status = response.statusCode();
                if (status < 200 || status >= 300) {
                    throw DailyApiErrorDecoder.decode(objectMapper, status, body);
                }
                byte[] bytes = body == null ? new byte[0] : body.readAllBytes();
                return bytes.length == 0 ? objectMapper.createObjectNode() : objectMapper.readTree(bytes);
            }
        } catch (HttpTimeoutException ex) {
            throw new VideoProviderException(method + " " + path + " timed out after " + requestTimeout, ex, true);
        } catch (IOException ex) {
            // no status code, so isRetryable() holds for connection failures
            throw new VideoProviderException(method + " " + path + " failed: " + ex.getMessage(), ex, false);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new VideoProviderException(method + " " + path + " interrupted", ex, false);
        }
    }

    private static void requireRoomName(String name) {
        if (name == null || !ROOM_NAME.matcher(name).matches()) {
            throw new IllegalArgumentException("Invalid provider room name: " + name);
        }
    }
}
