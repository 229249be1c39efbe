package com.example.signaling.api;

import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.example.signaling.handler.SessionEventLoop;
import com.example.signaling.model.CallKind;
import com.example.signaling.protocol.InboundMessage;
import com.example.signaling.support.RecordingConnection;
import com.example.signaling.support.SignalingFixture;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.converter.json.GsonHttpMessageConverter;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

class StatusControllerTest {

    private SignalingFixture fixture;
    private SessionEventLoop eventLoop;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        fixture = new SignalingFixture();
        eventLoop = new SessionEventLoop();
        StatusController controller = new StatusController(fixture.identityDirectory, fixture.connectionRegistry,
                fixture.roomDirectory, fixture.callSessionManager, eventLoop, fixture.clock);
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setMessageConverters(new GsonHttpMessageConverter())
                .build();
    }

    @AfterEach
    void tearDown() {
        eventLoop.shutdown();
    }

    @Test
    void healthReportsCounts() throws Exception {
        RecordingConnection alice = fixture.registered("a", "alice");
        fixture.registered("b", "bob");
        fixture.open("anonymous");
        fixture.router.dispatch(alice, new InboundMessage.JoinRoom("r1", null));
        fixture.router.dispatch(alice, new InboundMessage.InitiateCall("b", null, CallKind.AUDIO));

        mockMvc.perform(get("/api/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("healthy"))
                .andExpect(jsonPath("$.timestamp").value("2025-01-01T00:00:00Z"))
                .andExpect(jsonPath("$.connections").value(3))
                .andExpect(jsonPath("$.activeUsers").value(2))
                .andExpect(jsonPath("$.activeCalls").value(1))
                .andExpect(jsonPath("$.chatRooms").value(1));
    }

    @Test
    void healthOnEmptyServer() throws Exception {
        mockMvc.perform(get("/api/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.connections").value(0))
                .andExpect(jsonPath("$.activeUsers").value(0));
    }

    @Test
    void usersIncludesOfflineIdentities() throws Exception {
        RecordingConnection alice = fixture.registered("a", "alice");
        fixture.registered("b", "bob");
        fixture.close(alice);

        mockMvc.perform(get("/api/users"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.users.length()").value(2))
                .andExpect(jsonPath("$.users[*].username", containsInAnyOrder("alice", "bob")))
                .andExpect(jsonPath("$.users[?(@.username == 'alice')].status").value("offline"));
    }

    @Test
    void roomsListsSummaries() throws Exception {
        RecordingConnection alice = fixture.registered("a", "alice");
        fixture.router.dispatch(alice, new InboundMessage.JoinRoom("r1", "Lobby"));
        fixture.router.dispatch(alice, new InboundMessage.SendMessage("hello", null, "r1", "text"));

        mockMvc.perform(get("/api/rooms"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.rooms[0].id").value("r1"))
                .andExpect(jsonPath("$.rooms[0].name").value("Lobby"))
                .andExpect(jsonPath("$.rooms[0].participantCount").value(1))
                .andExpect(jsonPath("$.rooms[0].lastMessage.content").value("hello"));
    }
}
