package com.example.signaling.api;

import com.example.signaling.handler.SessionEventLoop;
import com.example.signaling.protocol.JsonViews;
import com.example.signaling.registry.CallSessionManager;
import com.example.signaling.registry.ConnectionRegistry;
import com.example.signaling.registry.IdentityDirectory;
import com.example.signaling.registry.RoomDirectory;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;

/**
 * 조회 전용 상태 API
 *
 * <p>디렉터리 스냅샷은 이벤트 루프에서 읽는다.</p>
 */
@RestController
@RequestMapping("/api")
@CrossOrigin(origins = "${signaling.websocket.allowed-origins:*}")
public class StatusController {

    private final IdentityDirectory identityDirectory;
    private final ConnectionRegistry connectionRegistry;
    private final RoomDirectory roomDirectory;
    private final CallSessionManager callSessionManager;
    private final SessionEventLoop eventLoop;
    private final Clock clock;

    public StatusController(IdentityDirectory identityDirectory,
                            ConnectionRegistry connectionRegistry,
                            RoomDirectory roomDirectory,
                            CallSessionManager callSessionManager,
                            SessionEventLoop eventLoop,
                            Clock clock) {
        this.identityDirectory = identityDirectory;
        this.connectionRegistry = connectionRegistry;
        this.roomDirectory = roomDirectory;
        this.callSessionManager = callSessionManager;
        this.eventLoop = eventLoop;
        this.clock = clock;
    }

    @GetMapping("/health")
    public JsonObject health() {
        return eventLoop.call(() -> {
            JsonObject response = new JsonObject();
            response.addProperty("status", "healthy");
            response.addProperty("timestamp", clock.instant().toString());
            response.addProperty("connections", connectionRegistry.connectionCount());
            response.addProperty("activeUsers", identityDirectory.size());
            response.addProperty("activeCalls", callSessionManager.activeCount());
            response.addProperty("chatRooms", roomDirectory.size());
            return response;
        });
    }

    @GetMapping("/users")
    public JsonObject users() {
        return eventLoop.call(() -> {
            JsonObject response = new JsonObject();
            response.add("users", JsonViews.identities(identityDirectory.list()));
            return response;
        });
    }

    @GetMapping("/rooms")
    public JsonObject rooms() {
        return eventLoop.call(() -> {
            JsonArray rooms = new JsonArray();
            roomDirectory.listSummaries().forEach(summary -> rooms.add(JsonViews.roomSummary(summary)));
            JsonObject response = new JsonObject();
            response.add("rooms", rooms);
            return response;
        });
    }
}
