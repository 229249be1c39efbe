package com.example.signaling.registry;

import com.google.gson.JsonObject;

/**
 * 클라이언트와의 양방향 연결
 */
public interface Connection {

    String getId();

    boolean isOpen();

    /**
     * 이벤트를 연결의 송신 큐에 넣는다. 블로킹하지 않으며 연결 간 전송 순서는 보장하지 않는다.
     */
    DeliveryResult send(JsonObject event);
}
