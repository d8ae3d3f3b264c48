package com.dka.MissionServer.infra.persistence;

import com.dka.MissionServer.domain.Room;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 프로세스 메모리에 보관하는 방 목록.
 * 변경은 반드시 해당 방의 락({@code RoomLockFacade}) 안에서 호출한다.
 */
@Slf4j
@Repository
public class RoomRegistry {

    private final Map<String, Room> rooms = new ConcurrentHashMap<>();

    public Room getOrCreate(String roomId) {
        return rooms.computeIfAbsent(roomId, id -> {
            log.info("방 생성: {}", id);
            return Room.create(id);
        });
    }

    public Optional<Room> findRoomById(String roomId) {
        return Optional.ofNullable(rooms.get(roomId));
    }

    public boolean isRegistered(Room room) {
        return room != null && rooms.get(room.getRoomId()) == room;
    }

    public void delete(String roomId) {
        Room removed = rooms.remove(roomId);
        if (removed != null) {
            if (!removed.isEmpty()) {
                log.warn("플레이어가 남아있는 방 삭제: room={}, players={}", roomId, removed.getPlayerCount());
            }
            removed.cancelPendingReset();
            log.info("방 삭제 완료: {}", roomId);
        }
    }

    public List<String> findAllRoomIds() {
        return List.copyOf(rooms.keySet());
    }
}
