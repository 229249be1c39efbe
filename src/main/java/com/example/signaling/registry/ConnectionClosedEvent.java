package com.example.signaling.registry;

/**
 * 사용자가 바인딩된 연결이 닫혔을 때 발행된다. 바인딩이 해제되기 전에 동기적으로 처리된다.
 */
public record ConnectionClosedEvent(String connectionId, String identityId) {
}
