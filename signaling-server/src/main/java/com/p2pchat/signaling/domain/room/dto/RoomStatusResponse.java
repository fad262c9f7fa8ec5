package com.p2pchat.signaling.domain.room.dto;

public class RoomStatusResponse {

    private final String room;
    private final int occupants;
    private final boolean full;

    public RoomStatusResponse(String room, int occupants, boolean full) {
        this.room = room;
        this.occupants = occupants;
        this.full = full;
    }

    public String getRoom() {
        return room;
    }

    public int getOccupants() {
        return occupants;
    }

    public boolean isFull() {
        return full;
    }
}
