package com.example.signaling.registry;

import com.google.gson.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 연결 레지스트리
 *
 * <p>연결과 사용자 ID의 1:1 바인딩을 관리하며, 사용자에게 도달 가능한지 판단하는 유일한 기준이다.
 * 연결 자체의 생명주기는 전송 계층이 소유하고 여기서는 조회만 한다.</p>
 */
@Component
public class ConnectionRegistry {

    private static final Logger log = LoggerFactory.getLogger(ConnectionRegistry.class);

    private final ConcurrentHashMap<String, Connection> connectionsById = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, String> identityByConnectionId = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Connection> connectionByIdentityId = new ConcurrentHashMap<>();

    private final ApplicationEventPublisher eventPublisher;

    public ConnectionRegistry(ApplicationEventPublisher eventPublisher) {
        this.eventPublisher = eventPublisher;
    }

    /**
     * 새 연결 등록 (아직 사용자와 바인딩되지 않음)
     */
    public void register(Connection connection) {
        connectionsById.put(connection.getId(), connection);
        log.debug("연결 등록: {} (활성: {})", connection.getId(), connectionsById.size());
    }

    /**
     * 연결을 사용자와 바인딩한다. 연결에 다른 사용자가 바인딩되어 있었다면 교체한다.
     */
    public void bind(Connection connection, String identityId) {
        connectionsById.putIfAbsent(connection.getId(), connection);
        String previous = identityByConnectionId.put(connection.getId(), identityId);
        if (previous != null && !previous.equals(identityId)) {
            connectionByIdentityId.remove(previous, connection);
        }
        connectionByIdentityId.put(identityId, connection);
        log.debug("바인딩: {} -> {}", connection.getId(), identityId);
    }

    public Optional<String> unbind(Connection connection) {
        String identityId = identityByConnectionId.remove(connection.getId());
        if (identityId != null) {
            connectionByIdentityId.remove(identityId, connection);
        }
        return Optional.ofNullable(identityId);
    }

    public Optional<String> identityOf(Connection connection) {
        return Optional.ofNullable(identityByConnectionId.get(connection.getId()));
    }

    /**
     * 사용자의 살아있는 연결. 없으면 empty (오류 아님)
     */
    public Optional<Connection> resolve(String identityId) {
        if (identityId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(connectionByIdentityId.get(identityId))
                .filter(Connection::isOpen);
    }

    public DeliveryResult sendToUser(String identityId, JsonObject event) {
        return resolve(identityId)
                .map(connection -> connection.send(event))
                .orElse(DeliveryResult.UNREACHABLE);
    }

    /**
     * 주어진 사용자들에게 전송한다. 도달할 수 없는 사용자는 건너뛴다.
     *
     * @return 실제로 전달된 연결 수
     */
    public int sendToAll(Collection<String> identityIds, JsonObject event, String excludedId) {
        int delivered = 0;
        for (String identityId : identityIds) {
            if (Objects.equals(identityId, excludedId)) {
                continue;
            }
            if (sendToUser(identityId, event).isDelivered()) {
                delivered++;
            }
        }
        return delivered;
    }

    /**
     * 연결 종료 처리. 바인딩된 사용자가 있으면 연쇄 정리 이벤트를 먼저 발행한 뒤 바인딩을 제거한다.
     */
    public void onClose(Connection connection) {
        String identityId = identityByConnectionId.get(connection.getId());
        if (identityId != null) {
            eventPublisher.publishEvent(new ConnectionClosedEvent(connection.getId(), identityId));
        }
        unbind(connection);
        connectionsById.remove(connection.getId());
        log.debug("연결 제거: {} (활성: {})", connection.getId(), connectionsById.size());
    }

    public int connectionCount() {
        return connectionsById.size();
    }
}
