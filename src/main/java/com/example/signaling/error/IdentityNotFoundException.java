package com.example.signaling.error;

public class IdentityNotFoundException extends SignalingException {

    public IdentityNotFoundException(String username) {
        super(ErrorCode.USER_NOT_FOUND, "User not found: " + username);
    }
}
