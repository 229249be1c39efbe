package com.example.signaling.registry;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

import com.google.gson.JsonObject;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

class WebSocketConnectionTest {

    private static final long LIMIT = 64 * 1024;

    private WebSocketSession session;

    @BeforeEach
    void setUp() {
        session = mock(WebSocketSession.class);
        when(session.isOpen()).thenReturn(true);
    }

    private static JsonObject event(String type) {
        JsonObject event = new JsonObject();
        event.addProperty("type", type);
        return event;
    }

    @Test
    @DisplayName("보낸 순서대로 세션에 기록된다")
    void preservesOrder() throws Exception {
        List<Runnable> pending = new ArrayList<>();
        WebSocketConnection connection = new WebSocketConnection("c1", session, pending::add, LIMIT);

        assertThat(connection.send(event("FIRST"))).isEqualTo(DeliveryResult.DELIVERED);
        assertThat(connection.send(event("SECOND"))).isEqualTo(DeliveryResult.DELIVERED);
        assertThat(connection.send(event("THIRD"))).isEqualTo(DeliveryResult.DELIVERED);

        // 큐를 비우는 작업은 하나만 예약된다
        assertThat(pending).hasSize(1);
        pending.get(0).run();

        ArgumentCaptor<TextMessage> captor = ArgumentCaptor.forClass(TextMessage.class);
        verify(session, times(3)).sendMessage(captor.capture());
        assertThat(captor.getAllValues()).extracting(TextMessage::getPayload).containsExactly(
                "{\"type\":\"FIRST\"}", "{\"type\":\"SECOND\"}", "{\"type\":\"THIRD\"}");
    }

    @Test
    @DisplayName("닫힌 세션으로는 보내지 않고 UNREACHABLE")
    void closedSessionIsUnreachable() throws Exception {
        when(session.isOpen()).thenReturn(false);
        WebSocketConnection connection = new WebSocketConnection("c1", session, Runnable::run, LIMIT);

        assertThat(connection.isOpen()).isFalse();
        assertThat(connection.send(event("HELLO"))).isEqualTo(DeliveryResult.UNREACHABLE);
        verify(session, never()).sendMessage(any());
    }

    @Test
    @DisplayName("전송 실패는 로그만 남기고 다음 메시지를 계속 보낸다")
    void sendFailureDoesNotPropagate() throws Exception {
        doThrow(new IOException("broken pipe"))
                .doNothing()
                .when(session).sendMessage(any());
        WebSocketConnection connection = new WebSocketConnection("c1", session, Runnable::run, LIMIT);

        connection.send(event("LOST"));
        connection.send(event("KEPT"));

        verify(session, times(2)).sendMessage(any());
    }

    @Test
    @DisplayName("전송 작업이 거부되어도 예외 없이 이후 전송을 다시 예약한다")
    void rejectedDeliveryIsRescheduled() throws Exception {
        List<Runnable> accepted = new ArrayList<>();
        boolean[] reject = {true};
        Executor executor = task -> {
            if (reject[0]) {
                throw new RejectedExecutionException("shutting down");
            }
            accepted.add(task);
        };
        WebSocketConnection connection = new WebSocketConnection("c1", session, executor, LIMIT);

        connection.send(event("FIRST"));
        reject[0] = false;
        connection.send(event("SECOND"));

        assertThat(accepted).hasSize(1);
        accepted.get(0).run();
        verify(session, times(2)).sendMessage(any());
    }

    @Test
    @DisplayName("수신자가 멈춘 상태에서 버퍼 한도를 넘으면 연결을 닫고 이후 전송은 UNREACHABLE")
    void overflowClosesStalledConnection() throws Exception {
        List<Runnable> stalled = new ArrayList<>();
        // {"type":"FILL"} 는 15 bytes
        WebSocketConnection connection = new WebSocketConnection("c1", session, stalled::add, 40);

        assertThat(connection.send(event("FILL"))).isEqualTo(DeliveryResult.DELIVERED);
        assertThat(connection.send(event("FILL"))).isEqualTo(DeliveryResult.DELIVERED);
        assertThat(connection.getBufferedBytes()).isEqualTo(30);

        assertThat(connection.send(event("FILL"))).isEqualTo(DeliveryResult.UNREACHABLE);

        verify(session).close(CloseStatus.SESSION_NOT_RELIABLE);
        assertThat(connection.isOpen()).isFalse();
        assertThat(connection.getBufferedBytes()).isZero();

        for (int i = 0; i < 1000; i++) {
            assertThat(connection.send(event("FILL"))).isEqualTo(DeliveryResult.UNREACHABLE);
        }
        verify(session, times(1)).close(any(CloseStatus.class));

        // 멈춰 있던 전송 작업이 재개되어도 버려진 메시지는 보내지 않는다
        stalled.forEach(Runnable::run);
        verify(session, never()).sendMessage(any());
    }

    @Test
    @DisplayName("보낸 만큼 버퍼가 비워지면 한도 안에서 계속 보낼 수 있다")
    void drainedBytesAreReleased() throws Exception {
        WebSocketConnection connection = new WebSocketConnection("c1", session, Runnable::run, 40);

        for (int i = 0; i < 100; i++) {
            assertThat(connection.send(event("FILL"))).isEqualTo(DeliveryResult.DELIVERED);
        }

        assertThat(connection.getBufferedBytes()).isZero();
        verify(session, times(100)).sendMessage(any());
        verify(session, never()).close(any(CloseStatus.class));
    }
}
