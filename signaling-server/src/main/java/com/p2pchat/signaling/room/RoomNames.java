package com.p2pchat.signaling.room;

import java.util.regex.Pattern;

/**
 * 레지스트리 키로 쓰이는 방 이름 검증. 경로 구분자, 공백, 제어 문자를 허용하지 않는다.
 */
public final class RoomNames {

    public static final int MAX_LENGTH = 64;

    private static final Pattern VALID = Pattern.compile("^[A-Za-z0-9][A-Za-z0-9_.-]{0," + (MAX_LENGTH - 1) + "}$");

    private RoomNames() {
    }

    public static boolean isValid(String roomName) {
        return roomName != null && VALID.matcher(roomName).matches();
    }
}
