package com.example.signaling.registry;

import com.example.signaling.error.RoomNotFoundException;
import com.example.signaling.model.ChatMessage;
import com.example.signaling.model.Identity;
import com.example.signaling.model.Room;
import com.example.signaling.model.RoomSummary;
import com.example.signaling.protocol.ServerEvents;
import com.google.gson.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 채팅방 디렉터리
 *
 * <p>방은 첫 입장 시 생성되고 프로세스가 살아있는 동안 유지된다.
 * 참여자 집합에는 바인딩된 연결이 있는 사용자 ID만 남는다 (연결 종료 시 제거).</p>
 */
@Component
public class RoomDirectory {

    private static final Logger log = LoggerFactory.getLogger(RoomDirectory.class);

    private final ConcurrentHashMap<String, Room> rooms = new ConcurrentHashMap<>();

    private final ConnectionRegistry connectionRegistry;
    private final Clock clock;
    private final int historyLimit;

    public RoomDirectory(ConnectionRegistry connectionRegistry, Clock clock,
                         @Value("${signaling.room.history-limit:50}") int historyLimit) {
        this.connectionRegistry = connectionRegistry;
        this.clock = clock;
        this.historyLimit = historyLimit;
    }

    /**
     * 방 입장. 방이 없으면 만들고, 이미 참여 중이면 아무 것도 바꾸지 않는다.
     * 새로 들어온 경우에만 기존 참여자에게 입장을 알린다.
     */
    public Room join(String roomId, String roomName, Identity member) {
        Room room = rooms.computeIfAbsent(roomId, id -> {
            String name = roomName != null ? roomName : "Room " + id;
            log.info("방 생성: {} ({})", id, name);
            return new Room(id, name, clock.instant(), historyLimit);
        });

        if (room.addParticipant(member.getId())) {
            log.info("방 입장: {} -> {} (참여자: {})", member.getUsername(), roomId, room.getParticipantCount());
            broadcast(roomId, ServerEvents.userJoinedRoom(roomId, member), member.getId());
        }
        return room;
    }

    /**
     * 방 퇴장. 방이나 참여 기록이 없으면 알림 없이 false
     */
    public boolean leave(String roomId, String identityId) {
        Room room = rooms.get(roomId);
        if (room == null || !room.removeParticipant(identityId)) {
            return false;
        }
        log.info("방 퇴장: {} <- {} (참여자: {})", roomId, identityId, room.getParticipantCount());
        broadcast(roomId, ServerEvents.userLeftRoom(roomId, identityId), identityId);
        return true;
    }

    /**
     * 히스토리에 추가하고 보낸 사람을 제외한 참여자에게 전달한다.
     *
     * @throws RoomNotFoundException 방이 없는 경우
     */
    public Room appendMessage(String roomId, ChatMessage message) {
        Room room = rooms.get(roomId);
        if (room == null) {
            throw new RoomNotFoundException(roomId);
        }
        room.append(message);
        broadcast(roomId, ServerEvents.message(ServerEvents.NEW_MESSAGE, message), message.fromId());
        return room;
    }

    /**
     * 방 참여자에게 전송. 호출 시점의 참여자 스냅샷을 대상으로 한다.
     *
     * @return 전달된 연결 수 (방이 없으면 0)
     */
    public int broadcast(String roomId, JsonObject event, String excludedId) {
        Room room = rooms.get(roomId);
        if (room == null) {
            return 0;
        }
        return connectionRegistry.sendToAll(room.participantSnapshot(), event, excludedId);
    }

    /**
     * 사용자가 참여한 모든 방에서 퇴장시킨다.
     *
     * @return 퇴장 처리된 방 ID 목록
     */
    public List<String> leaveAll(String identityId) {
        List<String> roomIds = rooms.values().stream()
                .filter(room -> room.hasParticipant(identityId))
                .map(Room::getId)
                .toList();

        List<String> left = new ArrayList<>();
        for (String roomId : roomIds) {
            if (leave(roomId, identityId)) {
                left.add(roomId);
            }
        }
        return left;
    }

    public Optional<Room> find(String roomId) {
        return Optional.ofNullable(roomId).map(rooms::get);
    }

    public List<RoomSummary> listSummaries() {
        return rooms.values().stream()
                .map(Room::summarize)
                .toList();
    }

    public int size() {
        return rooms.size();
    }
}
