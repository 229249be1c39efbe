package com.example.signaling.error;

public abstract class SignalingException extends RuntimeException {

    private final ErrorCode code;

    protected SignalingException(ErrorCode code, String message) {
        super(message);
        this.code = code;
    }

    protected SignalingException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public ErrorCode getCode() {
        return code;
    }
}
