package com.meetlink.backend.modules.provider.application;

import java.time.Duration;
import java.time.OffsetDateTime;

import com.meetlink.backend.modules.provider.domain.ProviderRoom;

/**
 * The three provider operations the meeting lifecycle relies on. Every call is bounded by
 * the adapter's timeout and fails with {@link VideoProviderException}.
 */
public interface VideoProviderClient {

    /**
     * Creates a room that the provider itself expires at {@code expiresAt}, independent of
     * any local enforcement.
     */
    ProviderRoom createRoom(String name, OffsetDateTime expiresAt, int maxParticipants);

    /**
     * Deletes a room. Deleting a room the provider no longer knows is not an error.
     */
    void deleteRoom(String name);

    String mintParticipantToken(String roomName, String participantName, Duration ttl);
}
