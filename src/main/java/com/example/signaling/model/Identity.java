package com.example.signaling.model;

import java.time.Instant;

/**
 * 등록된 사용자 프로필과 접속 상태
 *
 * <p>ID는 연결 단위로 부여되며 재로그인 시 새 연결의 ID로 바뀐다.
 * 상태 변경은 {@code IdentityDirectory} 를 통해서만 이루어진다.</p>
 */
public class Identity {

    private String id;
    private final String username;
    private final String avatar;
    private PresenceStatus status;
    private Instant lastSeen;

    public Identity(String id, String username, String avatar, Instant lastSeen) {
        this.id = id;
        this.username = username;
        this.avatar = avatar;
        this.status = PresenceStatus.ONLINE;
        this.lastSeen = lastSeen;
    }

    public String getId() {
        return id;
    }

    public String getUsername() {
        return username;
    }

    public String getAvatar() {
        return avatar;
    }

    public PresenceStatus getStatus() {
        return status;
    }

    public Instant getLastSeen() {
        return lastSeen;
    }

    public boolean isOnline() {
        return status == PresenceStatus.ONLINE;
    }

    public void reassign(String newId, Instant now) {
        this.id = newId;
        updatePresence(PresenceStatus.ONLINE, now);
    }

    public void updatePresence(PresenceStatus status, Instant now) {
        this.status = status;
        this.lastSeen = now;
    }
}
