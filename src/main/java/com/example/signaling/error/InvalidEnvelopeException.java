package com.example.signaling.error;

/**
 * 파싱할 수 없거나 필수 필드가 빠진 메시지
 */
public class InvalidEnvelopeException extends SignalingException {

    public InvalidEnvelopeException(String message) {
        super(ErrorCode.INVALID_ENVELOPE, message);
    }

    public InvalidEnvelopeException(String message, Throwable cause) {
        super(ErrorCode.INVALID_ENVELOPE, message, cause);
    }

    protected InvalidEnvelopeException(ErrorCode code, String message) {
        super(code, message);
    }
}
