package com.example.signaling.error;

public class DuplicateIdentityException extends SignalingException {

    public DuplicateIdentityException(String username) {
        super(ErrorCode.USERNAME_EXISTS,
                "Username \"" + username + "\" already exists. Please choose a different username.");
    }
}
