package com.example.signaling.error;

public class RoomNotFoundException extends SignalingException {

    public RoomNotFoundException(String roomId) {
        super(ErrorCode.ROOM_NOT_FOUND, "Room not found: " + roomId);
    }
}
