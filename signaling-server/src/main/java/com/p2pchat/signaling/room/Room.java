package com.p2pchat.signaling.room;

import com.p2pchat.signaling.model.ParticipantRole;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 최대 두 명의 참가자를 담는 방. 모든 상태 변경은 {@link #lock()} 구간 안에서만 일어난다.
 */
class Room {

    static final int MAX_PARTICIPANTS = 2;

    private final String name;
    private final Instant createdAt;
    private final ReentrantLock lock = new ReentrantLock();
    private final List<Occupant> occupants = new ArrayList<>(MAX_PARTICIPANTS);
    private long sequence;
    private boolean retired;

    Room(String name, Instant createdAt) {
        this.name = name;
        this.createdAt = createdAt;
    }

    void lock() {
        lock.lock();
    }

    void unlock() {
        lock.unlock();
    }

    String getName() {
        return name;
    }

    Instant getCreatedAt() {
        return createdAt;
    }

    boolean isRetired() {
        return retired;
    }

    // 마지막 참가자가 나간 방은 재사용하지 않는다. 새 join은 새 Room 객체를 만든다.
    void retire() {
        retired = true;
    }

    boolean isFull() {
        return occupants.size() >= MAX_PARTICIPANTS;
    }

    int size() {
        return occupants.size();
    }

    boolean contains(String sessionId) {
        return find(sessionId) != null;
    }

    void add(Participant participant, ParticipantRole role) {
        if (isFull()) {
            throw new IllegalStateException("Room " + name + " already has " + MAX_PARTICIPANTS + " participants");
        }
        occupants.add(new Occupant(participant, role));
    }

    Occupant remove(String sessionId) {
        Occupant occupant = find(sessionId);
        if (occupant != null) {
            occupants.remove(occupant);
        }
        return occupant;
    }

    /**
     * sessionId가 아닌 다른 참가자. sessionId가 null이면 아무 참가자나 반환한다.
     */
    Occupant other(String sessionId) {
        for (Occupant occupant : occupants) {
            if (!occupant.participant().getSessionId().equals(sessionId)) {
                return occupant;
            }
        }
        return null;
    }

    long nextSequence() {
        return ++sequence;
    }

    private Occupant find(String sessionId) {
        for (Occupant occupant : occupants) {
            if (occupant.participant().getSessionId().equals(sessionId)) {
                return occupant;
            }
        }
        return null;
    }

    static final class Occupant {
        private final Participant participant;
        private final ParticipantRole role;

        Occupant(Participant participant, ParticipantRole role) {
            this.participant = participant;
            this.role = role;
        }

        Participant participant() {
            return participant;
        }

        ParticipantRole role() {
            return role;
        }
    }
}
