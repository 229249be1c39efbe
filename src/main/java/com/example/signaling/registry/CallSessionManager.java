package com.example.signaling.registry;

import com.example.signaling.error.CallNotFoundException;
import com.example.signaling.error.RoomNotFoundException;
import com.example.signaling.model.Call;
import com.example.signaling.model.CallKind;
import com.example.signaling.protocol.ServerEvents;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.IdGenerator;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 통화 세션 관리
 *
 * <p>통화의 생명주기를 단독으로 소유한다. 거절/종료된 통화는 즉시 활성 목록에서 제거되므로
 * 종료 상태의 통화에 대한 요청은 모두 {@link CallNotFoundException} 이 된다.
 * 울리는 중인 통화에는 타임아웃이 없다.</p>
 */
@Component
public class CallSessionManager {

    private static final Logger log = LoggerFactory.getLogger(CallSessionManager.class);

    private final ConcurrentHashMap<String, Call> activeCalls = new ConcurrentHashMap<>();

    private final RoomDirectory roomDirectory;
    private final ConnectionRegistry connectionRegistry;
    private final IdGenerator idGenerator;
    private final Clock clock;

    public CallSessionManager(RoomDirectory roomDirectory, ConnectionRegistry connectionRegistry,
                              IdGenerator idGenerator, Clock clock) {
        this.roomDirectory = roomDirectory;
        this.connectionRegistry = connectionRegistry;
        this.idGenerator = idGenerator;
        this.clock = clock;
    }

    /**
     * 통화 시작
     *
     * <p>roomId 가 있으면 그 시점의 방 참여자 스냅샷이 그대로 참여자가 된다. 방에 없는 사람이
     * 시작하면 발신자는 참여자에 들어가지 않고 CALL_INITIATED 만 받는다.
     * roomId 가 없으면 발신자와 상대방이며, 자기 자신에게 건 통화는 참여자가 한 명이다.</p>
     *
     * @throws RoomNotFoundException roomId 의 방이 없는 경우
     */
    public Call initiate(String initiatorId, String targetId, CallKind kind, String roomId) {
        List<String> participants;
        if (roomId != null) {
            participants = roomDirectory.find(roomId)
                    .orElseThrow(() -> new RoomNotFoundException(roomId))
                    .participantSnapshot();
        } else {
            participants = List.copyOf(new LinkedHashSet<>(Arrays.asList(initiatorId, targetId)));
        }

        Call call = new Call(idGenerator.generateId().toString(), initiatorId, participants, kind,
                roomId, clock.instant());
        activeCalls.put(call.getId(), call);
        log.info("통화 시작: {} ({}, 참여자: {})", call.getId(), kind.getValue(), participants.size());

        connectionRegistry.sendToAll(participants, ServerEvents.call(ServerEvents.INCOMING_CALL, call), initiatorId);
        connectionRegistry.sendToUser(initiatorId, ServerEvents.call(ServerEvents.CALL_INITIATED, call));
        return call;
    }

    /**
     * ringing → active
     */
    public Call answer(String callId, String answererId) {
        Call call = require(callId);
        call.answer(answererId, clock.instant());
        log.info("통화 응답: {} by {}", callId, answererId);

        notifyParticipants(call, ServerEvents.CALL_ANSWERED);
        return call;
    }

    /**
     * ringing → rejected, 활성 목록에서 제거
     */
    public Call reject(String callId, String rejecterId) {
        Call call = require(callId);
        call.reject(rejecterId, clock.instant());
        activeCalls.remove(callId);
        log.info("통화 거절: {} by {}", callId, rejecterId);

        notifyParticipants(call, ServerEvents.CALL_REJECTED);
        return call;
    }

    /**
     * ringing|active → ended, 활성 목록에서 제거
     */
    public Call end(String callId, String enderId) {
        Call call = require(callId);
        call.end(enderId, clock.instant());
        activeCalls.remove(callId);
        log.info("통화 종료: {} by {}", callId, enderId);

        notifyParticipants(call, ServerEvents.CALL_ENDED);
        return call;
    }

    /**
     * 사용자가 참여한 모든 통화를 그 사용자 이름으로 종료한다 (연결 종료 처리 전용).
     */
    public List<Call> terminateAllFor(String identityId) {
        List<String> callIds = activeCalls.values().stream()
                .filter(call -> call.hasParticipant(identityId))
                .map(Call::getId)
                .toList();

        List<Call> ended = new ArrayList<>();
        for (String callId : callIds) {
            ended.add(end(callId, identityId));
        }
        return ended;
    }

    public Optional<Call> find(String callId) {
        return Optional.ofNullable(callId).map(activeCalls::get);
    }

    public Call require(String callId) {
        return find(callId).orElseThrow(() -> new CallNotFoundException(callId));
    }

    public int activeCount() {
        return activeCalls.size();
    }

    private void notifyParticipants(Call call, String eventType) {
        connectionRegistry.sendToAll(call.getParticipantIds(), ServerEvents.call(eventType, call), null);
    }
}
