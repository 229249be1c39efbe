package com.example.signaling.registry;

import com.example.signaling.error.DuplicateIdentityException;
import com.example.signaling.error.IdentityNotFoundException;
import com.example.signaling.model.Identity;
import com.example.signaling.model.PresenceStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 사용자 디렉터리
 *
 * <p>사용자 ID와 프로필/접속 상태를 관리한다. 사용자명은 등록된 사용자 사이에서 유일하다.
 * 등록, 재로그인, 상태 변경이 성공하면 {@link PresenceChangedEvent} 를 발행한다.</p>
 */
@Component
public class IdentityDirectory {

    private static final Logger log = LoggerFactory.getLogger(IdentityDirectory.class);

    private final ConcurrentHashMap<String, Identity> identitiesById = new ConcurrentHashMap<>();

    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    public IdentityDirectory(ApplicationEventPublisher eventPublisher, Clock clock) {
        this.eventPublisher = eventPublisher;
        this.clock = clock;
    }

    /**
     * 신규 사용자 등록
     *
     * @param identityId 요청한 연결의 ID
     * @throws DuplicateIdentityException 같은 사용자명이 이미 등록된 경우 (디렉터리는 변경되지 않음)
     */
    public Identity register(String identityId, String username, String avatar) {
        if (findByUsername(username).isPresent()) {
            throw new DuplicateIdentityException(username);
        }
        Identity identity = new Identity(identityId, username, avatar, clock.instant());
        identitiesById.put(identityId, identity);
        log.info("사용자 등록: {} ({})", username, identityId);

        eventPublisher.publishEvent(new PresenceChangedEvent(identity, PresenceChangedEvent.Kind.REGISTERED));
        return identity;
    }

    /**
     * 재로그인. 기존 사용자를 제거한 뒤 새 연결의 ID로 다시 넣는다.
     *
     * @throws IdentityNotFoundException 해당 사용자명이 없는 경우
     */
    public Identity reclaim(String identityId, String username) {
        Identity identity = findByUsername(username)
                .orElseThrow(() -> new IdentityNotFoundException(username));

        String previousId = identity.getId();
        identitiesById.remove(previousId);
        identity.reassign(identityId, clock.instant());
        identitiesById.put(identityId, identity);
        log.info("사용자 재로그인: {} ({} -> {})", username, previousId, identityId);

        eventPublisher.publishEvent(new PresenceChangedEvent(identity, PresenceChangedEvent.Kind.RECLAIMED));
        return identity;
    }

    /**
     * 접속 상태 변경. 알 수 없는 사용자면 아무 것도 하지 않는다.
     */
    public Optional<Identity> setStatus(String identityId, PresenceStatus status) {
        Identity identity = identitiesById.get(identityId);
        if (identity == null) {
            return Optional.empty();
        }
        identity.updatePresence(status, clock.instant());
        log.debug("상태 변경: {} -> {}", identity.getUsername(), status.getValue());

        eventPublisher.publishEvent(new PresenceChangedEvent(identity, PresenceChangedEvent.Kind.STATUS_CHANGED));
        return Optional.of(identity);
    }

    public Optional<Identity> find(String identityId) {
        return Optional.ofNullable(identityId).map(identitiesById::get);
    }

    public Optional<Identity> findByUsername(String username) {
        return identitiesById.values().stream()
                .filter(identity -> identity.getUsername().equals(username))
                .findFirst();
    }

    public List<Identity> list() {
        return List.copyOf(identitiesById.values());
    }

    public List<Identity> list(String excludedId) {
        return identitiesById.values().stream()
                .filter(identity -> !Objects.equals(identity.getId(), excludedId))
                .toList();
    }

    public int size() {
        return identitiesById.size();
    }
}
