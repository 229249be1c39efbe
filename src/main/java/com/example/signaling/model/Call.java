package com.example.signaling.model;

import com.example.signaling.error.IllegalCallTransitionException;

import java.time.Instant;
import java.util.List;

/**
 * 다자간 통화 세션
 *
 * <p>참여자 목록은 생성 시점의 스냅샷이며 이후 변경되지 않는다.
 * 상태는 {@link CallStatus#canTransitionTo(CallStatus)} 규칙을 따라 한 방향으로만 바뀐다.</p>
 */
public class Call {

    private final String id;
    private final String initiatorId;
    private final List<String> participantIds;
    private final CallKind kind;
    private final String roomId;
    private final Instant startedAt;

    private CallStatus status = CallStatus.RINGING;
    private String answeredBy;
    private Instant answeredAt;
    private String rejectedBy;
    private String endedBy;
    private Instant endedAt;

    public Call(String id, String initiatorId, List<String> participantIds, CallKind kind,
                String roomId, Instant startedAt) {
        this.id = id;
        this.initiatorId = initiatorId;
        this.participantIds = List.copyOf(participantIds);
        this.kind = kind;
        this.roomId = roomId;
        this.startedAt = startedAt;
    }

    public void answer(String answererId, Instant now) {
        transitionTo(CallStatus.ACTIVE);
        this.answeredBy = answererId;
        this.answeredAt = now;
    }

    public void reject(String rejecterId, Instant now) {
        transitionTo(CallStatus.REJECTED);
        this.rejectedBy = rejecterId;
        this.endedAt = now;
    }

    public void end(String enderId, Instant now) {
        transitionTo(CallStatus.ENDED);
        this.endedBy = enderId;
        this.endedAt = now;
    }

    private void transitionTo(CallStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalCallTransitionException(id, status, next);
        }
        this.status = next;
    }

    public boolean hasParticipant(String identityId) {
        return participantIds.contains(identityId);
    }

    public String getId() {
        return id;
    }

    public String getInitiatorId() {
        return initiatorId;
    }

    public List<String> getParticipantIds() {
        return participantIds;
    }

    public CallKind getKind() {
        return kind;
    }

    public String getRoomId() {
        return roomId;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public CallStatus getStatus() {
        return status;
    }

    public String getAnsweredBy() {
        return answeredBy;
    }

    public Instant getAnsweredAt() {
        return answeredAt;
    }

    public String getRejectedBy() {
        return rejectedBy;
    }

    public String getEndedBy() {
        return endedBy;
    }

    public Instant getEndedAt() {
        return endedAt;
    }
}
