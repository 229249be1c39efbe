package com.example.signaling.registry;

/**
 * 1:1 전달 결과. 수신자가 없으면 재시도나 큐잉 없이 버린다.
 */
public enum DeliveryResult {
    DELIVERED,
    UNREACHABLE;

    public boolean isDelivered() {
        return this == DELIVERED;
    }
}
