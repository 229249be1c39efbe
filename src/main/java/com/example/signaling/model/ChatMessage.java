package com.example.signaling.model;

import java.time.Instant;

/**
 * 채팅 메시지. 방 히스토리에만 보관된다.
 *
 * @param toId   1:1 메시지 수신자 (방 메시지이면 null)
 * @param roomId 방 메시지의 방 ID (1:1 메시지이면 null)
 */
public record ChatMessage(
        String id,
        String fromId,
        String toId,
        String roomId,
        String content,
        String messageType,
        Instant createdAt
) {
}
