package com.example.signaling.routing;

import com.example.signaling.error.SignalingException;
import com.example.signaling.model.Call;
import com.example.signaling.model.ChatMessage;
import com.example.signaling.model.Identity;
import com.example.signaling.model.PresenceStatus;
import com.example.signaling.model.Room;
import com.example.signaling.protocol.InboundMessage;
import com.example.signaling.protocol.ServerEvents;
import com.example.signaling.registry.CallSessionManager;
import com.example.signaling.registry.Connection;
import com.example.signaling.registry.ConnectionClosedEvent;
import com.example.signaling.registry.ConnectionRegistry;
import com.example.signaling.registry.DeliveryResult;
import com.example.signaling.registry.IdentityDirectory;
import com.example.signaling.registry.PresenceChangedEvent;
import com.example.signaling.registry.RoomDirectory;
import com.google.gson.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import org.springframework.util.IdGenerator;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.List;
import java.util.Optional;

/**
 * 메시지 라우터
 *
 * <p>디코딩된 메시지를 타입별로 정확히 하나의 핸들러에 넘기고, 1:1 / 방 / 전체 전송을 수행한다.
 * 모든 호출은 이벤트 루프 스레드에서 하나씩 실행된다.</p>
 *
 * <p>오류 처리:</p>
 * <ul>
 *   <li>USERNAME_EXISTS, USER_NOT_FOUND - 보낸 연결에 ERROR 응답</li>
 *   <li>그 외 (방/통화 없음, 잘못된 통화 전이) - 로그만 남기고 버림</li>
 * </ul>
 */
@Component
public class MessageRouter {

    private static final Logger log = LoggerFactory.getLogger(MessageRouter.class);

    private final IdentityDirectory identityDirectory;
    private final ConnectionRegistry connectionRegistry;
    private final RoomDirectory roomDirectory;
    private final CallSessionManager callSessionManager;
    private final IdGenerator idGenerator;
    private final Clock clock;
    private final String defaultAvatarUrl;

    public MessageRouter(IdentityDirectory identityDirectory,
                         ConnectionRegistry connectionRegistry,
                         RoomDirectory roomDirectory,
                         CallSessionManager callSessionManager,
                         IdGenerator idGenerator,
                         Clock clock,
                         @Value("${signaling.avatar.default-url:https://api.dicebear.com/7.x/avataaars/svg?seed=%s}")
                         String defaultAvatarUrl) {
        this.identityDirectory = identityDirectory;
        this.connectionRegistry = connectionRegistry;
        this.roomDirectory = roomDirectory;
        this.callSessionManager = callSessionManager;
        this.idGenerator = idGenerator;
        this.clock = clock;
        this.defaultAvatarUrl = defaultAvatarUrl;
    }

    /**
     * 새 연결 등록 후 CONNECTED 전송
     */
    public void onOpen(Connection connection) {
        connectionRegistry.register(connection);
        connection.send(ServerEvents.connected(connection.getId(), clock.instant()));
        log.info("연결됨: {}", connection.getId());
    }

    public void dispatch(Connection connection, InboundMessage message) {
        log.debug("메시지 수신 [{}]: {}", connection.getId(), message.type());

        try {
            switch (message.type()) {
                case USER_REGISTER -> handleRegister(connection, (InboundMessage.RegisterUser) message);
                case USER_LOGIN -> handleLogin(connection, (InboundMessage.LoginUser) message);
                case GET_USERS -> handleGetUsers(connection);
                case SEND_MESSAGE -> handleSendMessage(connection, (InboundMessage.SendMessage) message);
                case JOIN_ROOM -> handleJoinRoom(connection, (InboundMessage.JoinRoom) message);
                case LEAVE_ROOM -> handleLeaveRoom(connection, (InboundMessage.LeaveRoom) message);
                case INITIATE_CALL -> handleInitiateCall(connection, (InboundMessage.InitiateCall) message);
                case ANSWER_CALL, REJECT_CALL, END_CALL ->
                        handleCallAction(connection, (InboundMessage.CallAction) message);
                case WEBRTC_OFFER, WEBRTC_ANSWER, WEBRTC_ICE_CANDIDATE ->
                        handleSignal(connection, (InboundMessage.Signal) message);
                case TYPING_START, TYPING_STOP -> handleTyping(connection, (InboundMessage.Typing) message);
                case USER_STATUS_CHANGE -> handleStatusChange(connection, (InboundMessage.StatusChange) message);
            }
        } catch (SignalingException e) {
            if (e.getCode().isReportedToSender()) {
                log.info("요청 거부 [{}] {}: {}", connection.getId(), e.getCode(), e.getMessage());
                connection.send(ServerEvents.error(e.getCode(), e.getMessage()));
            } else {
                log.debug("메시지 무시 [{}] {}: {}", connection.getId(), e.getCode(), e.getMessage());
            }
        }
    }

    private void handleRegister(Connection connection, InboundMessage.RegisterUser message) {
        String avatar = message.avatar() != null ? message.avatar() : defaultAvatar(message.username());
        Identity identity = identityDirectory.register(connection.getId(), message.username(), avatar);
        connectionRegistry.bind(connection, identity.getId());
        connection.send(ServerEvents.user(ServerEvents.USER_REGISTERED, identity));
    }

    private void handleLogin(Connection connection, InboundMessage.LoginUser message) {
        Identity identity = identityDirectory.reclaim(connection.getId(), message.username());
        connectionRegistry.bind(connection, identity.getId());
        connection.send(ServerEvents.user(ServerEvents.USER_LOGGED_IN, identity));
    }

    private void handleGetUsers(Connection connection) {
        boundIdentity(connection).ifPresent(caller ->
                connection.send(ServerEvents.usersList(identityDirectory.list(caller.getId()))));
    }

    private void handleSendMessage(Connection connection, InboundMessage.SendMessage message) {
        Optional<Identity> sender = boundIdentity(connection);
        if (sender.isEmpty()) {
            return;
        }
        String fromId = sender.get().getId();
        String toId = message.roomId() == null ? message.to() : null;
        ChatMessage chatMessage = new ChatMessage(idGenerator.generateId().toString(), fromId, toId,
                message.roomId(), message.content(), message.messageType(), clock.instant());

        if (message.roomId() != null) {
            roomDirectory.appendMessage(message.roomId(), chatMessage);
        } else {
            DeliveryResult result = sendToUser(toId, ServerEvents.message(ServerEvents.NEW_MESSAGE, chatMessage));
            log.debug("1:1 메시지 {} -> {}: {}", fromId, toId, result);
        }
        connection.send(ServerEvents.message(ServerEvents.MESSAGE_SENT, chatMessage));
    }

    private void handleJoinRoom(Connection connection, InboundMessage.JoinRoom message) {
        boundIdentity(connection).ifPresent(identity -> {
            Room room = roomDirectory.join(message.roomId(), message.roomName(), identity);
            connection.send(ServerEvents.roomJoined(room));
        });
    }

    private void handleLeaveRoom(Connection connection, InboundMessage.LeaveRoom message) {
        boundIdentity(connection).ifPresent(identity -> roomDirectory.leave(message.roomId(), identity.getId()));
    }

    private void handleInitiateCall(Connection connection, InboundMessage.InitiateCall message) {
        boundIdentity(connection).ifPresent(identity -> callSessionManager.initiate(
                identity.getId(), message.to(), message.callKind(), message.roomId()));
    }

    private void handleCallAction(Connection connection, InboundMessage.CallAction message) {
        Optional<Identity> actor = boundIdentity(connection);
        if (actor.isEmpty()) {
            return;
        }
        String actorId = actor.get().getId();
        switch (message.type()) {
            case ANSWER_CALL -> callSessionManager.answer(message.callId(), actorId);
            case REJECT_CALL -> callSessionManager.reject(message.callId(), actorId);
            case END_CALL -> callSessionManager.end(message.callId(), actorId);
            default -> throw new IllegalArgumentException("Not a call action: " + message.type());
        }
    }

    /**
     * 시그널링 중계. to 가 있으면 그 사용자에게, 아니면 통화의 다른 참여자 전원에게 보낸다.
     */
    private void handleSignal(Connection connection, InboundMessage.Signal message) {
        Optional<Identity> sender = boundIdentity(connection);
        if (sender.isEmpty()) {
            return;
        }
        String fromId = sender.get().getId();
        JsonObject relay = ServerEvents.relay(message.payload(), fromId);

        if (message.to() != null) {
            sendToUser(message.to(), relay);
        } else {
            Call call = callSessionManager.require(message.callId());
            connectionRegistry.sendToAll(call.getParticipantIds(), relay, fromId);
        }
    }

    private void handleTyping(Connection connection, InboundMessage.Typing message) {
        boundIdentity(connection).ifPresent(identity -> {
            JsonObject typing = ServerEvents.typing(message.payload(), identity);
            if (message.roomId() != null) {
                roomDirectory.broadcast(message.roomId(), typing, identity.getId());
            } else {
                sendToUser(message.to(), typing);
            }
        });
    }

    private void handleStatusChange(Connection connection, InboundMessage.StatusChange message) {
        connectionRegistry.identityOf(connection)
                .ifPresent(identityId -> identityDirectory.setStatus(identityId, message.status()));
    }

    /**
     * 등록/재로그인/상태 변경을 본인을 제외한 모든 사용자에게 알린다.
     */
    @EventListener
    public void onPresenceChanged(PresenceChangedEvent event) {
        Identity identity = event.identity();
        JsonObject payload = switch (event.kind()) {
            case REGISTERED -> ServerEvents.user(ServerEvents.USER_JOINED, identity);
            case RECLAIMED, STATUS_CHANGED -> ServerEvents.statusUpdate(identity);
        };
        broadcastToAll(payload, identity.getId());
    }

    /**
     * 연결 종료 연쇄 처리: 오프라인 전환 및 알림, 참여 중인 통화 종료, 참여 중인 방 퇴장
     */
    @EventListener
    public void onConnectionClosed(ConnectionClosedEvent event) {
        String identityId = event.identityId();
        identityDirectory.setStatus(identityId, PresenceStatus.OFFLINE);

        List<Call> endedCalls = callSessionManager.terminateAllFor(identityId);
        List<String> leftRooms = roomDirectory.leaveAll(identityId);
        log.info("연결 종료 정리 [{}] - 통화 {}건 종료, 방 {}곳 퇴장", identityId, endedCalls.size(), leftRooms.size());
    }

    public DeliveryResult sendToUser(String identityId, JsonObject event) {
        return connectionRegistry.sendToUser(identityId, event);
    }

    public int broadcastToAll(JsonObject event, String excludedId) {
        List<String> identityIds = identityDirectory.list().stream()
                .map(Identity::getId)
                .toList();
        return connectionRegistry.sendToAll(identityIds, event, excludedId);
    }

    private Optional<Identity> boundIdentity(Connection connection) {
        Optional<Identity> identity = connectionRegistry.identityOf(connection)
                .flatMap(identityDirectory::find);
        if (identity.isEmpty()) {
            log.debug("등록되지 않은 연결의 요청 무시: {}", connection.getId());
        }
        return identity;
    }

    private String defaultAvatar(String username) {
        return String.format(defaultAvatarUrl, URLEncoder.encode(username, StandardCharsets.UTF_8));
    }
}
