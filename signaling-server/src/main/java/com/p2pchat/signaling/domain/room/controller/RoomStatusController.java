package com.p2pchat.signaling.domain.room.controller;

import com.p2pchat.signaling.domain.room.dto.RoomStatusResponse;
import com.p2pchat.signaling.room.RoomNames;
import com.p2pchat.signaling.room.RoomRegistry;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * room-full 재시도 여부 판단용 방 점유 현황 조회.
 */
@RestController
@RequestMapping("/api/rooms")
public class RoomStatusController {

    private final RoomRegistry roomRegistry;

    public RoomStatusController(RoomRegistry roomRegistry) {
        this.roomRegistry = roomRegistry;
    }

    @GetMapping("/{room}/status")
    public ResponseEntity<RoomStatusResponse> status(@PathVariable String room) {
        if (!RoomNames.isValid(room)) {
            throw new IllegalArgumentException("Invalid room name");
        }
        int occupants = roomRegistry.occupancy(room);
        return ResponseEntity.ok(new RoomStatusResponse(room, occupants, occupants >= RoomRegistry.ROOM_CAPACITY));
    }
}
