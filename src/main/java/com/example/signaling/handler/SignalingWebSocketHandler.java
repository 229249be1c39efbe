package com.example.signaling.handler;

import com.example.signaling.error.InvalidEnvelopeException;
import com.example.signaling.error.UnknownMessageTypeException;
import com.example.signaling.protocol.EnvelopeCodec;
import com.example.signaling.protocol.InboundMessage;
import com.example.signaling.registry.ConnectionRegistry;
import com.example.signaling.registry.WebSocketConnection;
import com.example.signaling.routing.MessageRouter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.util.IdGenerator;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.util.concurrent.Executor;

/**
 * 채팅/통화 시그널링 웹소켓 핸들러
 *
 * <p>전송 계층 이벤트를 {@link SessionEventLoop} 에 넘기는 역할만 한다.
 * 메시지 디코딩은 수신 스레드에서, 상태 변경은 이벤트 루프에서 수행된다.</p>
 */
@Component
public class SignalingWebSocketHandler extends TextWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(SignalingWebSocketHandler.class);

    static final String CONNECTION_ATTRIBUTE = "signaling.connection";

    private final MessageRouter router;
    private final ConnectionRegistry connectionRegistry;
    private final EnvelopeCodec codec;
    private final SessionEventLoop eventLoop;
    private final IdGenerator idGenerator;
    private final Executor deliveryExecutor;
    private final long bufferLimitBytes;

    public SignalingWebSocketHandler(MessageRouter router,
                                     ConnectionRegistry connectionRegistry,
                                     EnvelopeCodec codec,
                                     SessionEventLoop eventLoop,
                                     IdGenerator idGenerator,
                                     @Qualifier("deliveryExecutor") Executor deliveryExecutor,
                                     @Value("${signaling.delivery.buffer-limit-bytes:524288}") long bufferLimitBytes) {
        this.router = router;
        this.connectionRegistry = connectionRegistry;
        this.codec = codec;
        this.eventLoop = eventLoop;
        this.idGenerator = idGenerator;
        this.deliveryExecutor = deliveryExecutor;
        this.bufferLimitBytes = bufferLimitBytes;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        WebSocketConnection connection = new WebSocketConnection(
                idGenerator.generateId().toString(), session, deliveryExecutor, bufferLimitBytes);
        session.getAttributes().put(CONNECTION_ATTRIBUTE, connection);

        log.debug("WebSocket 연결됨: {} -> {}", session.getId(), connection.getId());
        eventLoop.execute(() -> router.onOpen(connection));
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        WebSocketConnection connection = connectionOf(session);
        if (connection == null) {
            log.error("연결 정보를 찾을 수 없음: {}", session.getId());
            return;
        }

        InboundMessage inbound;
        try {
            inbound = codec.decode(message.getPayload());
        } catch (UnknownMessageTypeException e) {
            log.warn("알 수 없는 메시지 타입 [{}]: {}", connection.getId(), e.getType());
            return;
        } catch (InvalidEnvelopeException e) {
            log.warn("잘못된 메시지 [{}]: {}", connection.getId(), e.getMessage());
            return;
        }
        eventLoop.execute(() -> router.dispatch(connection, inbound));
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        WebSocketConnection connection = connectionOf(session);
        log.error("전송 에러 [{}]: {}", connection != null ? connection.getId() : session.getId(),
                exception.getMessage());
        if (connection != null && session.isOpen()) {
            // 종료 처리는 afterConnectionClosed 에서
            connection.close();
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        WebSocketConnection connection = connectionOf(session);
        if (connection == null) {
            return;
        }
        log.info("WebSocket 연결 종료: {} - {}", connection.getId(), status);
        eventLoop.execute(() -> connectionRegistry.onClose(connection));
    }

    private static WebSocketConnection connectionOf(WebSocketSession session) {
        return (WebSocketConnection) session.getAttributes().get(CONNECTION_ATTRIBUTE);
    }
}
