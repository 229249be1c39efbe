package com.example.signaling.protocol;

import com.example.signaling.error.ErrorCode;
import com.example.signaling.model.Call;
import com.example.signaling.model.ChatMessage;
import com.example.signaling.model.Identity;
import com.example.signaling.model.Room;
import com.google.gson.JsonObject;

import java.time.Instant;
import java.util.List;

/**
 * 서버 → 클라이언트 이벤트
 *
 * <pre>
 *   { "type": "CONNECTED", "clientId": "...", "timestamp": "..." }
 *   { "type": "USER_REGISTERED" | "USER_LOGGED_IN" | "USER_JOINED", "user": {...} }
 *   { "type": "USER_STATUS_UPDATE", "userId": "...", "status": "...", "lastSeen": "..." }
 *   { "type": "NEW_MESSAGE" | "MESSAGE_SENT", "message": {...} }
 *   { "type": "INCOMING_CALL" | "CALL_INITIATED" | "CALL_ANSWERED" | "CALL_REJECTED" | "CALL_ENDED", "call": {...} }
 *   { "type": "ERROR", "error": "...", "message": "..." }
 * </pre>
 */
public final class ServerEvents {

    public static final String CONNECTED = "CONNECTED";
    public static final String USER_REGISTERED = "USER_REGISTERED";
    public static final String USER_LOGGED_IN = "USER_LOGGED_IN";
    public static final String USER_JOINED = "USER_JOINED";
    public static final String USER_STATUS_UPDATE = "USER_STATUS_UPDATE";
    public static final String USERS_LIST = "USERS_LIST";
    public static final String NEW_MESSAGE = "NEW_MESSAGE";
    public static final String MESSAGE_SENT = "MESSAGE_SENT";
    public static final String ROOM_JOINED = "ROOM_JOINED";
    public static final String USER_JOINED_ROOM = "USER_JOINED_ROOM";
    public static final String USER_LEFT_ROOM = "USER_LEFT_ROOM";
    public static final String INCOMING_CALL = "INCOMING_CALL";
    public static final String CALL_INITIATED = "CALL_INITIATED";
    public static final String CALL_ANSWERED = "CALL_ANSWERED";
    public static final String CALL_REJECTED = "CALL_REJECTED";
    public static final String CALL_ENDED = "CALL_ENDED";
    public static final String ERROR = "ERROR";

    private ServerEvents() {
    }

    public static JsonObject connected(String clientId, Instant timestamp) {
        JsonObject event = event(CONNECTED);
        event.addProperty("clientId", clientId);
        event.addProperty("timestamp", timestamp.toString());
        return event;
    }

    public static JsonObject user(String type, Identity identity) {
        JsonObject event = event(type);
        event.add("user", JsonViews.identity(identity));
        return event;
    }

    public static JsonObject statusUpdate(Identity identity) {
        JsonObject event = event(USER_STATUS_UPDATE);
        event.addProperty("userId", identity.getId());
        event.addProperty("status", identity.getStatus().getValue());
        event.addProperty("lastSeen", identity.getLastSeen().toString());
        return event;
    }

    public static JsonObject usersList(List<Identity> identities) {
        JsonObject event = event(USERS_LIST);
        event.add("users", JsonViews.identities(identities));
        return event;
    }

    public static JsonObject message(String type, ChatMessage message) {
        JsonObject event = event(type);
        event.add("message", JsonViews.message(message));
        return event;
    }

    public static JsonObject roomJoined(Room room) {
        JsonObject event = event(ROOM_JOINED);
        event.add("room", JsonViews.room(room));
        return event;
    }

    public static JsonObject userJoinedRoom(String roomId, Identity identity) {
        JsonObject event = event(USER_JOINED_ROOM);
        event.addProperty("roomId", roomId);
        event.addProperty("userId", identity.getId());
        event.addProperty("username", identity.getUsername());
        return event;
    }

    public static JsonObject userLeftRoom(String roomId, String identityId) {
        JsonObject event = event(USER_LEFT_ROOM);
        event.addProperty("roomId", roomId);
        event.addProperty("userId", identityId);
        return event;
    }

    public static JsonObject call(String type, Call call) {
        JsonObject event = event(type);
        event.add("call", JsonViews.call(call));
        return event;
    }

    /**
     * 시그널링 중계. 원본 필드는 그대로 두고 from 만 덮어쓴다.
     */
    public static JsonObject relay(JsonObject payload, String fromId) {
        JsonObject event = payload.deepCopy();
        event.addProperty("from", fromId);
        return event;
    }

    public static JsonObject typing(JsonObject payload, Identity from) {
        JsonObject event = relay(payload, from.getId());
        event.addProperty("username", from.getUsername());
        return event;
    }

    public static JsonObject error(ErrorCode code, String message) {
        JsonObject event = event(ERROR);
        event.addProperty("error", code.name());
        event.addProperty("message", message);
        return event;
    }

    private static JsonObject event(String type) {
        JsonObject event = new JsonObject();
        event.addProperty("type", type);
        return event;
    }
}
