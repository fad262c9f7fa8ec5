package com.p2pchat.signaling.room;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class RoomNamesTest {

    @ParameterizedTest
    @ValueSource(strings = {"r1", "testroom", "Team-42", "a.b_c", "9"})
    void acceptsPlainNames(String name) {
        assertThat(RoomNames.isValid(name)).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = {"", " ", "a/b", "a\\b", "..", ".hidden", "-r", "room name", "r\n1", "r\t1", "방"})
    void rejectsSeparatorsControlAndUnsupportedCharacters(String name) {
        assertThat(RoomNames.isValid(name)).isFalse();
    }

    @Test
    void rejectsNullAndOverlongNames() {
        assertThat(RoomNames.isValid(null)).isFalse();
        assertThat(RoomNames.isValid("a".repeat(RoomNames.MAX_LENGTH))).isTrue();
        assertThat(RoomNames.isValid("a".repeat(RoomNames.MAX_LENGTH + 1))).isFalse();
    }
}
