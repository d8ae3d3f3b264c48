package com.dka.MissionServer.domain;

import com.dka.MissionServer.domain.type.RoomStatus;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ScheduledFuture;

@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@ToString(exclude = "pendingReset")
public class Room {

    private String roomId;

    @Builder.Default
    private List<Player> players = new ArrayList<>(); // 0번 = 캡틴

    @Builder.Default
    private RoomStatus status = RoomStatus.LOBBY;

    @JsonIgnore
    private ScheduledFuture<?> pendingReset; // 리더보드 종료 후 리셋 예약

    public static Room create(String roomId) {
        return Room.builder()
                .roomId(roomId)
                .status(RoomStatus.LOBBY)
                .build();
    }

    public void addPlayer(Player player) {
        if (this.players == null) {
            this.players = new ArrayList<>();
        }
        this.players.add(player);
    }

    public boolean removePlayer(String playerId) {
        return this.players != null && this.players.removeIf(p -> Objects.equals(p.getId(), playerId));
    }

    public Optional<Player> findPlayer(String playerId) {
        if (this.players == null) {
            return Optional.empty();
        }
        return this.players.stream()
                .filter(p -> Objects.equals(p.getId(), playerId))
                .findFirst();
    }

    public boolean hasPlayer(String playerId) {
        return findPlayer(playerId).isPresent();
    }

    @JsonIgnore
    public Player getCaptain() {
        return isEmpty() ? null : this.players.get(0);
    }

    public boolean isCaptain(String playerId) {
        Player captain = getCaptain();
        return captain != null && Objects.equals(captain.getId(), playerId);
    }

    public boolean isEmpty() {
        return this.players == null || this.players.isEmpty();
    }

    public int getPlayerCount() {
        return this.players == null ? 0 : this.players.size();
    }

    public boolean isFull(int requiredPlayers) {
        return getPlayerCount() >= requiredPlayers;
    }

    public boolean isReadyToStart(int requiredPlayers) {
        return getPlayerCount() == requiredPlayers
                && this.players.stream().allMatch(Player::isReady);
    }

    public boolean isEveryoneDone() {
        return !isEmpty() && this.players.stream()
                .map(Player::getStatus)
                .allMatch(s -> s != null && s.isDone());
    }

    /**
     * 캡틴만 남기고 나머지를 내보낸 뒤 로비 상태로 되돌린다.
     *
     * @return 방에서 제거된 플레이어 목록 (kicked 알림 대상)
     */
    public List<Player> resetToCaptain() {
        List<Player> removed = new ArrayList<>();
        Player captain = getCaptain();
        if (captain != null) {
            removed.addAll(this.players.subList(1, this.players.size()));
            captain.resetForLobby();
            this.players = new ArrayList<>(List.of(captain));
        }
        this.status = RoomStatus.LOBBY;
        this.pendingReset = null;
        return removed;
    }

    public void cancelPendingReset() {
        if (this.pendingReset != null) {
            this.pendingReset.cancel(false);
            this.pendingReset = null;
        }
    }
}
