package com.example.signaling.registry;

import com.google.gson.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * WebSocket 세션 기반 연결
 *
 * <p>송신은 연결별 FIFO 큐에 쌓고 전송용 Executor 에서 비운다.
 * 한 연결은 동시에 하나의 작업만 큐를 비우므로 연결 안에서는 순서가 유지되고,
 * 느린 수신자가 이벤트 루프나 다른 연결을 막지 않는다.</p>
 *
 * <p>아직 보내지 못한 메시지가 {@code bufferLimitBytes} 를 넘으면 세션을
 * {@link CloseStatus#SESSION_NOT_RELIABLE} 로 닫는다. 이후 전송은 모두 UNREACHABLE 이고,
 * 정리는 일반 연결 종료와 같은 경로로 진행된다.</p>
 */
public class WebSocketConnection implements Connection {

    private static final Logger log = LoggerFactory.getLogger(WebSocketConnection.class);

    private final String id;
    private final WebSocketSession session;
    private final Executor deliveryExecutor;
    private final long bufferLimitBytes;
    private final Queue<TextMessage> outbound = new ConcurrentLinkedQueue<>();
    private final AtomicLong bufferedBytes = new AtomicLong();
    private final AtomicBoolean draining = new AtomicBoolean();
    private final AtomicBoolean overflowed = new AtomicBoolean();

    public WebSocketConnection(String id, WebSocketSession session, Executor deliveryExecutor,
                               long bufferLimitBytes) {
        this.id = id;
        this.session = session;
        this.deliveryExecutor = deliveryExecutor;
        this.bufferLimitBytes = bufferLimitBytes;
    }

    @Override
    public String getId() {
        return id;
    }

    public WebSocketSession getSession() {
        return session;
    }

    @Override
    public boolean isOpen() {
        return !overflowed.get() && session.isOpen();
    }

    @Override
    public DeliveryResult send(JsonObject event) {
        if (!isOpen()) {
            return DeliveryResult.UNREACHABLE;
        }
        TextMessage message = new TextMessage(event.toString());
        int size = message.getPayloadLength();
        if (bufferedBytes.addAndGet(size) > bufferLimitBytes) {
            bufferedBytes.addAndGet(-size);
            terminateOnOverflow();
            return DeliveryResult.UNREACHABLE;
        }
        outbound.add(message);
        scheduleDrain();
        return DeliveryResult.DELIVERED;
    }

    public long getBufferedBytes() {
        return bufferedBytes.get();
    }

    private void terminateOnOverflow() {
        if (!overflowed.compareAndSet(false, true)) {
            return;
        }
        log.warn("송신 버퍼 한도 초과 [{}]: {} bytes 대기 중, 연결 종료", id, bufferedBytes.get());
        outbound.clear();
        bufferedBytes.set(0);
        close(CloseStatus.SESSION_NOT_RELIABLE);
    }

    private void scheduleDrain() {
        if (!draining.compareAndSet(false, true)) {
            return;
        }
        try {
            deliveryExecutor.execute(this::drain);
        } catch (RejectedExecutionException e) {
            draining.set(false);
            log.warn("전송 작업 거부됨 [{}]: {}", id, e.getMessage());
        }
    }

    private void drain() {
        try {
            TextMessage message;
            while ((message = outbound.poll()) != null) {
                bufferedBytes.addAndGet(-message.getPayloadLength());
                if (!isOpen()) {
                    outbound.clear();
                    bufferedBytes.set(0);
                    return;
                }
                try {
                    session.sendMessage(message);
                } catch (IOException | IllegalStateException e) {
                    log.error("메시지 전송 실패 [{}]: {}", id, e.getMessage());
                }
            }
        } finally {
            draining.set(false);
        }
        // drain 종료 직전에 들어온 메시지
        if (!outbound.isEmpty()) {
            scheduleDrain();
        }
    }

    public void close() {
        close(CloseStatus.NORMAL);
    }

    private void close(CloseStatus status) {
        try {
            session.close(status);
        } catch (IOException e) {
            log.warn("연결 종료 실패 [{}]: {}", id, e.getMessage());
        }
    }
}
