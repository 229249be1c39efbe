package com.example.signaling.model;

import java.time.Instant;
import java.util.Optional;

public record RoomSummary(
        String id,
        String name,
        int participantCount,
        Optional<ChatMessage> lastMessage,
        Instant createdAt
) {
}
