package com.example.signaling.registry;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.List;

import com.example.signaling.support.RecordingConnection;
import com.google.gson.JsonObject;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ConnectionRegistryTest {

    private final List<Object> events = new ArrayList<>();
    private ConnectionRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new ConnectionRegistry(events::add);
    }

    private static JsonObject ping() {
        JsonObject event = new JsonObject();
        event.addProperty("type", "PING");
        return event;
    }

    @Test
    @DisplayName("바인딩된 사용자에게만 전달된다")
    void sendToBoundIdentity() {
        RecordingConnection a = new RecordingConnection("a");
        registry.register(a);
        registry.bind(a, "alice-id");

        assertThat(registry.sendToUser("alice-id", ping())).isEqualTo(DeliveryResult.DELIVERED);
        assertThat(registry.sendToUser("bob-id", ping())).isEqualTo(DeliveryResult.UNREACHABLE);
        assertThat(registry.sendToUser(null, ping())).isEqualTo(DeliveryResult.UNREACHABLE);
        assertThat(a.received()).hasSize(1);
    }

    @Test
    @DisplayName("닫힌 연결은 도달할 수 없는 것으로 본다")
    void closedConnectionIsUnreachable() {
        RecordingConnection a = new RecordingConnection("a");
        registry.bind(a, "alice-id");
        a.markClosed();

        assertThat(registry.resolve("alice-id")).isEmpty();
        assertThat(registry.sendToUser("alice-id", ping())).isEqualTo(DeliveryResult.UNREACHABLE);
    }

    @Test
    @DisplayName("다른 사용자로 다시 바인딩하면 이전 사용자 조회는 끊긴다")
    void rebindReplacesPreviousIdentity() {
        RecordingConnection a = new RecordingConnection("a");
        registry.bind(a, "first");
        registry.bind(a, "second");

        assertThat(registry.resolve("first")).isEmpty();
        assertThat(registry.resolve("second")).contains(a);
        assertThat(registry.identityOf(a)).contains("second");
    }

    @Test
    @DisplayName("전체 전송은 제외 대상과 도달 불가 사용자를 건너뛴다")
    void sendToAllSkipsExcludedAndUnreachable() {
        RecordingConnection a = new RecordingConnection("a");
        RecordingConnection b = new RecordingConnection("b");
        registry.bind(a, "a");
        registry.bind(b, "b");

        int delivered = registry.sendToAll(List.of("a", "b", "ghost"), ping(), "a");

        assertThat(delivered).isEqualTo(1);
        assertThat(a.received()).isEmpty();
        assertThat(b.received()).hasSize(1);
    }

    @Test
    @DisplayName("바인딩된 연결이 닫히면 종료 이벤트를 발행한 뒤 바인딩을 제거한다")
    void onCloseBound() {
        RecordingConnection a = new RecordingConnection("a");
        registry.register(a);
        registry.bind(a, "alice-id");

        registry.onClose(a);

        assertThat(events).containsExactly(new ConnectionClosedEvent("a", "alice-id"));
        assertThat(registry.identityOf(a)).isEmpty();
        assertThat(registry.connectionCount()).isZero();
    }

    @Test
    @DisplayName("바인딩 전 연결이 닫히면 이벤트 없이 제거된다")
    void onCloseAnonymous() {
        RecordingConnection a = new RecordingConnection("a");
        registry.register(a);

        registry.onClose(a);

        assertThat(events).isEmpty();
        assertThat(registry.connectionCount()).isZero();
    }
}
