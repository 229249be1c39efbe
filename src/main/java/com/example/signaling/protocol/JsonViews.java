package com.example.signaling.protocol;

import com.example.signaling.model.Call;
import com.example.signaling.model.ChatMessage;
import com.example.signaling.model.Identity;
import com.example.signaling.model.Room;
import com.example.signaling.model.RoomSummary;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;

import java.time.Instant;
import java.util.Collection;

/**
 * 엔티티 스냅샷의 JSON 표현. 웹소켓 이벤트와 조회 API 가 같은 형태를 쓴다.
 */
public final class JsonViews {

    private JsonViews() {
    }

    public static JsonObject identity(Identity identity) {
        JsonObject json = new JsonObject();
        json.addProperty("id", identity.getId());
        json.addProperty("username", identity.getUsername());
        json.addProperty("avatar", identity.getAvatar());
        json.addProperty("status", identity.getStatus().getValue());
        addTimestamp(json, "lastSeen", identity.getLastSeen());
        return json;
    }

    public static JsonArray identities(Collection<Identity> identities) {
        JsonArray array = new JsonArray();
        identities.forEach(identity -> array.add(identity(identity)));
        return array;
    }

    public static JsonObject message(ChatMessage message) {
        JsonObject json = new JsonObject();
        json.addProperty("id", message.id());
        json.addProperty("from", message.fromId());
        if (message.toId() != null) {
            json.addProperty("to", message.toId());
        }
        if (message.roomId() != null) {
            json.addProperty("roomId", message.roomId());
        }
        json.addProperty("content", message.content());
        json.addProperty("messageType", message.messageType());
        addTimestamp(json, "timestamp", message.createdAt());
        return json;
    }

    public static JsonObject call(Call call) {
        JsonObject json = new JsonObject();
        json.addProperty("id", call.getId());
        json.addProperty("initiator", call.getInitiatorId());
        json.add("participants", strings(call.getParticipantIds()));
        json.addProperty("callType", call.getKind().getValue());
        json.addProperty("status", call.getStatus().getValue());
        addTimestamp(json, "startTime", call.getStartedAt());
        if (call.getRoomId() != null) {
            json.addProperty("roomId", call.getRoomId());
        }
        if (call.getAnsweredBy() != null) {
            json.addProperty("answeredBy", call.getAnsweredBy());
            addTimestamp(json, "answerTime", call.getAnsweredAt());
        }
        if (call.getRejectedBy() != null) {
            json.addProperty("rejectedBy", call.getRejectedBy());
        }
        if (call.getEndedBy() != null) {
            json.addProperty("endedBy", call.getEndedBy());
        }
        addTimestamp(json, "endTime", call.getEndedAt());
        return json;
    }

    /**
     * 입장 응답용 방 상세 (최근 히스토리 포함)
     */
    public static JsonObject room(Room room) {
        JsonObject json = new JsonObject();
        json.addProperty("id", room.getId());
        json.addProperty("name", room.getName());
        json.add("participants", strings(room.participantSnapshot()));
        JsonArray messages = new JsonArray();
        room.recentHistory().forEach(message -> messages.add(message(message)));
        json.add("messages", messages);
        addTimestamp(json, "createdAt", room.getCreatedAt());
        return json;
    }

    public static JsonObject roomSummary(RoomSummary summary) {
        JsonObject json = new JsonObject();
        json.addProperty("id", summary.id());
        json.addProperty("name", summary.name());
        json.addProperty("participantCount", summary.participantCount());
        summary.lastMessage().ifPresent(last -> json.add("lastMessage", message(last)));
        addTimestamp(json, "createdAt", summary.createdAt());
        return json;
    }

    private static JsonArray strings(Collection<String> values) {
        JsonArray array = new JsonArray();
        values.forEach(array::add);
        return array;
    }

    private static void addTimestamp(JsonObject json, String field, Instant instant) {
        if (instant != null) {
            json.addProperty(field, instant.toString());
        }
    }
}
