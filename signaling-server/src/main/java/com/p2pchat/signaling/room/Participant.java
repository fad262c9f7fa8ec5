package com.p2pchat.signaling.room;

import com.p2pchat.signaling.model.Identity;
import com.p2pchat.signaling.model.ParticipantRole;
import com.p2pchat.signaling.model.SignalMessage;

/**
 * 레지스트리가 방 참가자에게 보내는 콜백.
 * 모든 호출은 해당 방의 락을 잡은 상태에서 이루어진다.
 */
public interface Participant {

    String getSessionId();

    Identity getIdentity();

    /**
     * 방에 등록된 직후 호출된다.
     */
    void assignedTo(String roomName, ParticipantRole role);

    /**
     * 방에서 제거된 직후 호출된다.
     */
    void releasedFrom(String roomName);

    /**
     * 아웃바운드 채널로 메시지를 보낸다. 세션이 닫혔거나 전송에 실패하면 false.
     */
    boolean deliver(SignalMessage message);
}
