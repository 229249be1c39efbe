package com.example.signaling.protocol;

import com.example.signaling.error.InvalidEnvelopeException;
import com.example.signaling.error.UnknownMessageTypeException;
import com.example.signaling.model.CallKind;
import com.example.signaling.model.PresenceStatus;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * 클라이언트 메시지 디코더
 *
 * <p>메시지 프로토콜:</p>
 * <pre>
 *   { "type": "USER_REGISTER", "username": "...", "avatar": "..." }
 *   { "type": "SEND_MESSAGE", "content": "...", "to": "..." | "roomId": "...", "messageType": "text" }
 *   { "type": "INITIATE_CALL", "to": "..." | "roomId": "...", "callType": "audio|video|screen" }
 *   { "type": "WEBRTC_OFFER", "to": "..." | "callId": "...", ... }
 * </pre>
 */
@Component
public class EnvelopeCodec {

    private static final Gson gson = new GsonBuilder().create();

    /**
     * @throws UnknownMessageTypeException 알 수 없는 type
     * @throws InvalidEnvelopeException    JSON 이 아니거나 필수 필드 누락
     */
    public InboundMessage decode(String payload) {
        JsonObject json = parse(payload);
        String tag = optionalString(json, "type")
                .orElseThrow(() -> new InvalidEnvelopeException("Missing field: type"));
        MessageType type = MessageType.fromTag(tag)
                .orElseThrow(() -> new UnknownMessageTypeException(tag));

        return switch (type) {
            case USER_REGISTER -> new InboundMessage.RegisterUser(
                    requiredString(json, "username"),
                    optionalString(json, "avatar").orElse(null));
            case USER_LOGIN -> new InboundMessage.LoginUser(requiredString(json, "username"));
            case GET_USERS -> new InboundMessage.ListUsers();
            case SEND_MESSAGE -> decodeSendMessage(json);
            case JOIN_ROOM -> new InboundMessage.JoinRoom(
                    requiredString(json, "roomId"),
                    optionalString(json, "roomName").orElse(null));
            case LEAVE_ROOM -> new InboundMessage.LeaveRoom(requiredString(json, "roomId"));
            case INITIATE_CALL -> decodeInitiateCall(json);
            case ANSWER_CALL, REJECT_CALL, END_CALL ->
                    new InboundMessage.CallAction(type, requiredString(json, "callId"));
            case WEBRTC_OFFER, WEBRTC_ANSWER, WEBRTC_ICE_CANDIDATE -> {
                String to = optionalString(json, "to").orElse(null);
                String callId = optionalString(json, "callId").orElse(null);
                requireOneOf(type, to, "to", callId, "callId");
                yield new InboundMessage.Signal(type, to, callId, json);
            }
            case TYPING_START, TYPING_STOP -> {
                String to = optionalString(json, "to").orElse(null);
                String roomId = optionalString(json, "roomId").orElse(null);
                requireOneOf(type, to, "to", roomId, "roomId");
                yield new InboundMessage.Typing(type, to, roomId, json);
            }
            case USER_STATUS_CHANGE -> {
                String status = requiredString(json, "status");
                yield new InboundMessage.StatusChange(PresenceStatus.fromValue(status)
                        .orElseThrow(() -> new InvalidEnvelopeException("Unsupported status: " + status)));
            }
        };
    }

    private InboundMessage decodeSendMessage(JsonObject json) {
        if (!json.has("content") || json.get("content").isJsonNull()) {
            throw new InvalidEnvelopeException("Missing field: content");
        }
        String content = stringValue(json.get("content"), "content");
        String to = optionalString(json, "to").orElse(null);
        String roomId = optionalString(json, "roomId").orElse(null);
        requireOneOf(MessageType.SEND_MESSAGE, to, "to", roomId, "roomId");
        String messageType = optionalString(json, "messageType").orElse("text");
        return new InboundMessage.SendMessage(content, to, roomId, messageType);
    }

    private InboundMessage decodeInitiateCall(JsonObject json) {
        String to = optionalString(json, "to").orElse(null);
        String roomId = optionalString(json, "roomId").orElse(null);
        requireOneOf(MessageType.INITIATE_CALL, to, "to", roomId, "roomId");
        CallKind kind = optionalString(json, "callType")
                .map(value -> CallKind.fromValue(value)
                        .orElseThrow(() -> new InvalidEnvelopeException("Unsupported callType: " + value)))
                .orElse(CallKind.AUDIO);
        return new InboundMessage.InitiateCall(to, roomId, kind);
    }

    private static JsonObject parse(String payload) {
        JsonObject json;
        try {
            json = gson.fromJson(payload, JsonObject.class);
        } catch (JsonParseException | ClassCastException e) {
            throw new InvalidEnvelopeException("Malformed JSON envelope", e);
        }
        if (json == null) {
            throw new InvalidEnvelopeException("Empty envelope");
        }
        return json;
    }

    private static void requireOneOf(MessageType type, String first, String firstName,
                                     String second, String secondName) {
        if (first == null && second == null) {
            throw new InvalidEnvelopeException(type + " requires " + firstName + " or " + secondName);
        }
    }

    private static String requiredString(JsonObject json, String field) {
        return optionalString(json, field)
                .orElseThrow(() -> new InvalidEnvelopeException("Missing field: " + field));
    }

    /**
     * 값이 없거나 null, 빈 문자열이면 empty
     */
    private static Optional<String> optionalString(JsonObject json, String field) {
        JsonElement element = json.get(field);
        if (element == null || element.isJsonNull()) {
            return Optional.empty();
        }
        String value = stringValue(element, field);
        return value.isBlank() ? Optional.empty() : Optional.of(value);
    }

    private static String stringValue(JsonElement element, String field) {
        if (!element.isJsonPrimitive()) {
            throw new InvalidEnvelopeException("Field must be a string: " + field);
        }
        return element.getAsString();
    }
}
