package com.example.signaling.error;

public class UnknownMessageTypeException extends InvalidEnvelopeException {

    private final String type;

    public UnknownMessageTypeException(String type) {
        super(ErrorCode.UNKNOWN_MESSAGE_TYPE, "Unknown message type: " + type);
        this.type = type;
    }

    public String getType() {
        return type;
    }
}
