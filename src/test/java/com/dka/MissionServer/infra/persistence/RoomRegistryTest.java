package com.dka.MissionServer.infra.persistence;

import com.dka.MissionServer.domain.Player;
import com.dka.MissionServer.domain.Room;
import com.dka.MissionServer.domain.type.RoomStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.ScheduledFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class RoomRegistryTest {

    private final RoomRegistry roomRegistry = new RoomRegistry();

    @Test
    @DisplayName("없는 방은 로비 상태의 빈 방으로 생성되고, 있는 방은 그대로 반환된다")
    void getOrCreate() {
        Room first = roomRegistry.getOrCreate("R");
        first.addPlayer(Player.join("sock-a", null));

        Room second = roomRegistry.getOrCreate("R");

        assertSame(first, second);
        assertEquals(RoomStatus.LOBBY, first.getStatus());
        assertEquals(List.of("R"), roomRegistry.findAllRoomIds());
    }

    @Test
    @DisplayName("삭제하면 조회되지 않고 예약된 리셋이 취소된다")
    void delete_CancelsPendingReset() {
        Room room = roomRegistry.getOrCreate("R");
        ScheduledFuture<?> future = mock(ScheduledFuture.class);
        room.setPendingReset(future);

        roomRegistry.delete("R");

        assertTrue(roomRegistry.findRoomById("R").isEmpty());
        assertFalse(roomRegistry.isRegistered(room));
        verify(future).cancel(false);
    }

    @Test
    @DisplayName("레지스트리는 인스턴스마다 독립적이다")
    void registries_AreIsolated() {
        RoomRegistry other = new RoomRegistry();
        roomRegistry.getOrCreate("R");

        assertTrue(other.findRoomById("R").isEmpty());
        assertTrue(other.findAllRoomIds().isEmpty());
    }

    @Test
    @DisplayName("없는 방 삭제는 아무 일도 하지 않는다")
    void delete_Unknown_NoOp() {
        assertDoesNotThrow(() -> roomRegistry.delete("missing"));
    }
}
