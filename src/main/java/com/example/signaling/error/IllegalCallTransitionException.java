package com.example.signaling.error;

import com.example.signaling.model.CallStatus;

public class IllegalCallTransitionException extends SignalingException {

    public IllegalCallTransitionException(String callId, CallStatus from, CallStatus to) {
        super(ErrorCode.INVALID_CALL_TRANSITION,
                "Call " + callId + " cannot move from " + from.getValue() + " to " + to.getValue());
    }
}
