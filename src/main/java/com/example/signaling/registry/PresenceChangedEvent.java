package com.example.signaling.registry;

import com.example.signaling.model.Identity;

/**
 * 등록/재로그인/상태 변경 시 발행되는 접속 상태 이벤트
 */
public record PresenceChangedEvent(Identity identity, Kind kind) {

    public enum Kind {
        REGISTERED,
        RECLAIMED,
        STATUS_CHANGED
    }
}
