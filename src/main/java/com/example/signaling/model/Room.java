package com.example.signaling.model;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * 채팅방
 *
 * <p>참여자 집합과 최근 메시지 히스토리를 가진다. 히스토리는 용량을 넘으면 가장 오래된 메시지부터 버린다.</p>
 */
public class Room {

    private final String id;
    private final String name;
    private final Instant createdAt;
    private final int historyLimit;
    private final Set<String> participantIds = new LinkedHashSet<>();
    private final Deque<ChatMessage> history = new ArrayDeque<>();

    public Room(String id, String name, Instant createdAt, int historyLimit) {
        if (historyLimit < 1) {
            throw new IllegalArgumentException("historyLimit must be positive: " + historyLimit);
        }
        this.id = id;
        this.name = name;
        this.createdAt = createdAt;
        this.historyLimit = historyLimit;
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public boolean addParticipant(String identityId) {
        return participantIds.add(identityId);
    }

    public boolean removeParticipant(String identityId) {
        return participantIds.remove(identityId);
    }

    public boolean hasParticipant(String identityId) {
        return participantIds.contains(identityId);
    }

    public int getParticipantCount() {
        return participantIds.size();
    }

    /**
     * 현재 참여자 목록의 복사본 (이후 입장/퇴장의 영향을 받지 않음)
     */
    public List<String> participantSnapshot() {
        return List.copyOf(participantIds);
    }

    public void append(ChatMessage message) {
        history.addLast(message);
        while (history.size() > historyLimit) {
            history.removeFirst();
        }
    }

    /**
     * 오래된 순으로 정렬된 최근 메시지 (최대 historyLimit 개)
     */
    public List<ChatMessage> recentHistory() {
        return new ArrayList<>(history);
    }

    public Optional<ChatMessage> lastMessage() {
        return Optional.ofNullable(history.peekLast());
    }

    public RoomSummary summarize() {
        return new RoomSummary(id, name, participantIds.size(), lastMessage(), createdAt);
    }
}
