package com.example.signaling.error;

/**
 * 시그널링 코어의 오류 분류
 *
 * <p>클라이언트에 응답으로 노출되는 코드는 {@link #USERNAME_EXISTS}, {@link #USER_NOT_FOUND} 두 가지뿐이다.</p>
 */
public enum ErrorCode {
    INVALID_ENVELOPE(false),
    UNKNOWN_MESSAGE_TYPE(false),
    USERNAME_EXISTS(true),
    USER_NOT_FOUND(true),
    ROOM_NOT_FOUND(false),
    CALL_NOT_FOUND(false),
    INVALID_CALL_TRANSITION(false);

    private final boolean reportedToSender;

    ErrorCode(boolean reportedToSender) {
        this.reportedToSender = reportedToSender;
    }

    public boolean isReportedToSender() {
        return reportedToSender;
    }
}
