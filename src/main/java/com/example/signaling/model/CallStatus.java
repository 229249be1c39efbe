package com.example.signaling.model;

/**
 * 통화 상태
 *
 * <pre>
 * ringing → active → ended
 * ringing → rejected
 * ringing → ended
 * </pre>
 *
 * <p>rejected, ended 는 종료 상태로 이후 어떤 전이도 허용하지 않는다.</p>
 */
public enum CallStatus {
    RINGING("ringing"),
    ACTIVE("active"),
    REJECTED("rejected"),
    ENDED("ended");

    private final String value;

    CallStatus(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public boolean isTerminal() {
        return this == REJECTED || this == ENDED;
    }

    public boolean canTransitionTo(CallStatus next) {
        return switch (this) {
            case RINGING -> next == ACTIVE || next == REJECTED || next == ENDED;
            case ACTIVE -> next == ENDED;
            case REJECTED, ENDED -> false;
        };
    }
}
