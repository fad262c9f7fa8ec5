package com.p2pchat.signaling.room;

import com.p2pchat.signaling.model.ParticipantRole;
import com.p2pchat.signaling.model.SignalMessage;
import java.time.Clock;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * 방 이름 -> 참가자 목록을 관리하는 프로세스 전역 레지스트리.
 *
 * <p>방마다 별도의 락을 두어 같은 방의 join/leave/relay는 직렬화하고, 서로 다른 방의 작업은
 * 서로를 막지 않는다. 피어 알림(peer-joined, peer-left)과 중계도 방 락 안에서 전달되므로
 * 한 방 안의 이벤트 순서가 결정적이다.
 *
 * <p>락은 재진입 가능하다. 전달 실패로 세션이 같은 스레드에서 닫히면 {@link #leave}가
 * 재진입할 수 있으므로, 알림 전달 이후에는 참가자 목록을 다시 확인한다.
 */
@Component
public class RoomRegistry {

    public static final int ROOM_CAPACITY = Room.MAX_PARTICIPANTS;

    private static final Logger log = LoggerFactory.getLogger(RoomRegistry.class);

    private final ConcurrentMap<String, Room> rooms = new ConcurrentHashMap<>();
    private final Clock clock;

    public RoomRegistry(Clock clock) {
        this.clock = clock;
    }

    /**
     * 참가자를 방에 등록한다. 이미 두 명이 있으면 상태를 바꾸지 않고 ROOM_FULL을 반환한다.
     * 성공하면 참가자에게 joined 응답을 보내고, 먼저 있던 피어가 있으면 양쪽에 peer-joined를 보낸다.
     */
    public JoinResult join(String roomName, Participant participant) {
        while (true) {
            Room room = rooms.computeIfAbsent(roomName, name -> new Room(name, clock.instant()));
            room.lock();
            try {
                if (room.isRetired()) {
                    // 방금 비워져 제거된 방. 새로 만들어진 항목으로 다시 시도한다.
                    continue;
                }
                if (room.contains(participant.getSessionId())) {
                    throw new IllegalStateException("Session " + participant.getSessionId()
                            + " already joined room " + roomName);
                }
                if (room.isFull()) {
                    log.debug("Room {} is full, rejected session {}", roomName, participant.getSessionId());
                    return JoinResult.roomFull();
                }
                return admit(room, participant);
            } finally {
                room.unlock();
            }
        }
    }

    /**
     * 참가자를 방에서 제거한다. 남은 참가자가 있으면 peer-left를 한 번 보내고, 없으면 방을 삭제한다.
     */
    public void leave(String roomName, String sessionId) {
        Room room = rooms.get(roomName);
        if (room == null) {
            return;
        }
        room.lock();
        try {
            if (room.isRetired()) {
                return;
            }
            Room.Occupant removed = room.remove(sessionId);
            if (removed == null) {
                return;
            }
            removed.participant().releasedFrom(roomName);
            log.debug("Session {} left room {}", sessionId, roomName);

            Room.Occupant survivor = room.other(sessionId);
            if (survivor == null) {
                room.retire();
                rooms.remove(roomName, room);
                log.info("Room {} closed due to no participants", roomName);
                return;
            }
            survivor.participant().deliver(SignalMessage.peerLeft(removed.participant().getIdentity(),
                    room.nextSequence()));
        } finally {
            room.unlock();
        }
    }

    /**
     * 같은 방의 다른 참가자에게 메시지를 그대로 전달한다.
     * 송신자가 방에 없거나 혼자이면 NO_PEER이며, 메시지는 버려진다.
     */
    public RelayResult relay(String roomName, String fromSessionId, SignalMessage message) {
        Room room = rooms.get(roomName);
        if (room == null) {
            return RelayResult.NO_PEER;
        }
        room.lock();
        try {
            if (room.isRetired() || !room.contains(fromSessionId)) {
                return RelayResult.NO_PEER;
            }
            Room.Occupant peer = room.other(fromSessionId);
            if (peer == null) {
                return RelayResult.NO_PEER;
            }
            return peer.participant().deliver(message) ? RelayResult.DELIVERED : RelayResult.NO_PEER;
        } finally {
            room.unlock();
        }
    }

    /**
     * 방에 현재 참가 중인 세션 수. 방이 없으면 0.
     */
    public int occupancy(String roomName) {
        Room room = rooms.get(roomName);
        if (room == null) {
            return 0;
        }
        room.lock();
        try {
            return room.isRetired() ? 0 : room.size();
        } finally {
            room.unlock();
        }
    }

    public int roomCount() {
        return rooms.size();
    }

    private JoinResult admit(Room room, Participant participant) {
        String roomName = room.getName();
        Room.Occupant existing = room.other(null);
        ParticipantRole role = existing == null ? ParticipantRole.OFFERER : existing.role().opposite();
        room.add(participant, role);
        participant.assignedTo(roomName, role);
        if (existing == null) {
            log.info("Room {} created by session {}", roomName, participant.getSessionId());
        }

        Participant peer = existing == null ? null : existing.participant();
        participant.deliver(SignalMessage.joined(roomName, role, peer == null ? null : peer.getIdentity()));
        if (peer == null) {
            return JoinResult.joined(role, null);
        }

        long sequence = room.nextSequence();
        // 새 참가자에게 먼저 알린다. 기존 피어 전송이 실패하면 이어지는 peer-left가 뒤따라 도착한다.
        if (room.contains(participant.getSessionId())) {
            participant.deliver(SignalMessage.peerJoined(peer.getIdentity(), existing.role(), sequence));
        }
        if (room.contains(participant.getSessionId()) && room.contains(peer.getSessionId())) {
            peer.deliver(SignalMessage.peerJoined(participant.getIdentity(), role, sequence));
        }
        log.info("Room {} paired sessions {} and {}", roomName, peer.getSessionId(), participant.getSessionId());
        return JoinResult.joined(role, peer.getIdentity());
    }
}
