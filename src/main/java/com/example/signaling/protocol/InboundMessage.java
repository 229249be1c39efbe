package com.example.signaling.protocol;

import com.example.signaling.model.CallKind;
import com.example.signaling.model.PresenceStatus;
import com.google.gson.JsonObject;

/**
 * 디코딩된 클라이언트 메시지. 타입마다 하나의 레코드가 대응된다.
 */
public sealed interface InboundMessage {

    MessageType type();

    record RegisterUser(String username, String avatar) implements InboundMessage {
        @Override
        public MessageType type() {
            return MessageType.USER_REGISTER;
        }
    }

    record LoginUser(String username) implements InboundMessage {
        @Override
        public MessageType type() {
            return MessageType.USER_LOGIN;
        }
    }

    record ListUsers() implements InboundMessage {
        @Override
        public MessageType type() {
            return MessageType.GET_USERS;
        }
    }

    /**
     * roomId 가 있으면 방 메시지, 없으면 to 로 보내는 1:1 메시지
     */
    record SendMessage(String content, String to, String roomId, String messageType) implements InboundMessage {
        @Override
        public MessageType type() {
            return MessageType.SEND_MESSAGE;
        }
    }

    record JoinRoom(String roomId, String roomName) implements InboundMessage {
        @Override
        public MessageType type() {
            return MessageType.JOIN_ROOM;
        }
    }

    record LeaveRoom(String roomId) implements InboundMessage {
        @Override
        public MessageType type() {
            return MessageType.LEAVE_ROOM;
        }
    }

    record InitiateCall(String to, String roomId, CallKind callKind) implements InboundMessage {
        @Override
        public MessageType type() {
            return MessageType.INITIATE_CALL;
        }
    }

    /**
     * ANSWER_CALL, REJECT_CALL, END_CALL
     */
    record CallAction(MessageType type, String callId) implements InboundMessage {
    }

    /**
     * WebRTC 시그널링. payload 는 해석하지 않고 그대로 중계한다.
     */
    record Signal(MessageType type, String to, String callId, JsonObject payload) implements InboundMessage {
    }

    record Typing(MessageType type, String to, String roomId, JsonObject payload) implements InboundMessage {
    }

    record StatusChange(PresenceStatus status) implements InboundMessage {
        @Override
        public MessageType type() {
            return MessageType.USER_STATUS_CHANGE;
        }
    }
}
