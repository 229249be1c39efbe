package com.example.signaling.error;

/**
 * 활성 통화 목록에 없는 통화 ID
 *
 * <p>종료/거절된 통화는 즉시 목록에서 제거되므로 뒤늦은 응답/종료 요청도 이 예외가 된다.</p>
 */
public class CallNotFoundException extends SignalingException {

    public CallNotFoundException(String callId) {
        super(ErrorCode.CALL_NOT_FOUND, "Call not found: " + callId);
    }
}
