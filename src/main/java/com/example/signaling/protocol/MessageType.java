package com.example.signaling.protocol;

import java.util.Arrays;
import java.util.Optional;

/**
 * 클라이언트 → 서버 메시지 타입 ({@code type} 필드)
 */
public enum MessageType {
    USER_REGISTER,
    USER_LOGIN,
    GET_USERS,
    SEND_MESSAGE,
    JOIN_ROOM,
    LEAVE_ROOM,
    INITIATE_CALL,
    ANSWER_CALL,
    REJECT_CALL,
    END_CALL,
    WEBRTC_OFFER,
    WEBRTC_ANSWER,
    WEBRTC_ICE_CANDIDATE,
    TYPING_START,
    TYPING_STOP,
    USER_STATUS_CHANGE;

    public static Optional<MessageType> fromTag(String tag) {
        return Arrays.stream(values())
                .filter(type -> type.name().equals(tag))
                .findFirst();
    }
}
