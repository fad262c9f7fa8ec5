package com.p2pchat.signaling.room;

import com.p2pchat.signaling.model.Identity;
import com.p2pchat.signaling.model.ParticipantRole;
import java.util.Optional;

/**
 * {@link RoomRegistry#join} 결과. 성공 시 배정된 역할과 먼저 들어와 있던 피어를 담는다.
 */
public final class JoinResult {

    private static final JoinResult ROOM_FULL = new JoinResult(false, null, null);

    private final boolean joined;
    private final ParticipantRole role;
    private final Identity peer;

    private JoinResult(boolean joined, ParticipantRole role, Identity peer) {
        this.joined = joined;
        this.role = role;
        this.peer = peer;
    }

    public static JoinResult joined(ParticipantRole role, Identity peer) {
        return new JoinResult(true, role, peer);
    }

    public static JoinResult roomFull() {
        return ROOM_FULL;
    }

    public boolean isJoined() {
        return joined;
    }

    public boolean isRoomFull() {
        return !joined;
    }

    public ParticipantRole getRole() {
        return role;
    }

    public Optional<Identity> getPeer() {
        return Optional.ofNullable(peer);
    }
}
