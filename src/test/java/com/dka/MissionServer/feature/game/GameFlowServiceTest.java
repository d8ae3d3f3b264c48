package com.dka.MissionServer.feature.game;

import com.dka.MissionServer.config.MissionProperties;
import com.dka.MissionServer.domain.Player;
import com.dka.MissionServer.domain.Room;
import com.dka.MissionServer.domain.type.PlayerStatus;
import com.dka.MissionServer.domain.type.RoomStatus;
import com.dka.MissionServer.feature.lobby.LobbyResponseSender;
import com.dka.MissionServer.infra.persistence.RoomRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.ScheduledFuture;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class GameFlowServiceTest {

    private static final long NOW = 1_700_000_000_000L;
    private static final long LEADERBOARD_DURATION = 10_000L;

    @Mock private GameResponseSender gameResponseSender;
    @Mock private LobbyResponseSender lobbyResponseSender;
    @Mock private TaskScheduler taskScheduler;

    private RoomRegistry roomRegistry;
    private GameFlowService gameFlowService;

    @BeforeEach
    void setUp() {
        roomRegistry = new RoomRegistry();
        MissionProperties properties = new MissionProperties(2, 3000L, LEADERBOARD_DURATION);
        Clock clock = Clock.fixed(Instant.ofEpochMilli(NOW), ZoneOffset.UTC);

        gameFlowService = new GameFlowService(roomRegistry, new RoomLockFacade(), gameResponseSender,
                lobbyResponseSender, taskScheduler, properties, clock);
    }

    private Room fullRoom(boolean ready) {
        Room room = roomRegistry.getOrCreate("R");
        Player a = Player.join("sock-a", "A");
        Player b = Player.join("sock-b", "B");
        a.setReady(ready);
        b.setReady(ready);
        room.addPlayer(a);
        room.addPlayer(b);
        return room;
    }

    private Room playingRoomAllDone() {
        Room room = fullRoom(true);
        room.setStatus(RoomStatus.PLAYING);
        room.getPlayers().get(0).setStatus(PlayerStatus.FINISHED);
        room.getPlayers().get(1).setStatus(PlayerStatus.DEAD);
        return room;
    }

    private Runnable captureScheduledReset() {
        ArgumentCaptor<Runnable> taskCaptor = ArgumentCaptor.forClass(Runnable.class);
        verify(taskScheduler).schedule(taskCaptor.capture(), any(Instant.class));
        return taskCaptor.getValue();
    }

    // 자동 시작

    @Test
    @DisplayName("정원이 차고 모두 준비되면 PLAYING으로 바뀌고 3초 뒤 시작 시각을 브로드캐스트한다")
    void checkAndStartGame_Starts() {
        Room room = fullRoom(true);

        boolean started = gameFlowService.checkAndStartGame(room);

        assertTrue(started);
        assertEquals(RoomStatus.PLAYING, room.getStatus());
        verify(gameResponseSender).broadcastStartGame(room, NOW + 3000L);
    }

    @Test
    @DisplayName("이미 PLAYING이면 다시 검사해도 start_game을 중복 전송하지 않는다")
    void checkAndStartGame_Idempotent() {
        Room room = fullRoom(true);

        gameFlowService.checkAndStartGame(room);
        boolean again = gameFlowService.checkAndStartGame(room);

        assertFalse(again);
        verify(gameResponseSender, times(1)).broadcastStartGame(eq(room), anyLong());
    }

    @Test
    @DisplayName("준비하지 않은 플레이어가 있거나 정원 미달이면 시작하지 않는다")
    void checkAndStartGame_NotReady() {
        Room room = fullRoom(false);
        room.getPlayers().get(0).setReady(true);
        assertFalse(gameFlowService.checkAndStartGame(room));

        Room half = roomRegistry.getOrCreate("HALF");
        Player solo = Player.join("sock-s", null);
        solo.setReady(true);
        half.addPlayer(solo);
        assertFalse(gameFlowService.checkAndStartGame(half));

        assertEquals(RoomStatus.LOBBY, room.getStatus());
        assertEquals(RoomStatus.LOBBY, half.getStatus());
        verifyNoInteractions(gameResponseSender);
    }

    @Test
    @DisplayName("리더보드(GAME_OVER) 중 전원이 다시 준비하면 재시작하고, 남은 리셋은 실행 시 중단된다")
    void checkAndStartGame_FromGameOver_RestartsAndResetAborts() {
        // given
        Room room = playingRoomAllDone();
        gameFlowService.checkAndEndGame(room);
        Runnable reset = captureScheduledReset();
        assertEquals(RoomStatus.GAME_OVER, room.getStatus());

        // when
        boolean started = gameFlowService.checkAndStartGame(room);
        reset.run();

        // then
        assertTrue(started);
        assertEquals(RoomStatus.PLAYING, room.getStatus());
        verify(gameResponseSender).broadcastStartGame(room, NOW + 3000L);
        assertEquals(List.of("sock-a", "sock-b"), room.getPlayers().stream().map(Player::getId).toList());
        verifyNoInteractions(lobbyResponseSender);
    }

    // 종료 판정

    @Test
    @DisplayName("진행 중에 전원이 DEAD/FINISHED면 GAME_OVER로 바뀌고 리셋이 한 번 예약된다")
    void checkAndEndGame_EndsAndSchedulesReset() {
        // given
        Room room = playingRoomAllDone();
        ScheduledFuture<?> future = mock(ScheduledFuture.class);
        doReturn(future).when(taskScheduler).schedule(any(Runnable.class), any(Instant.class));

        // when
        boolean ended = gameFlowService.checkAndEndGame(room);

        // then
        assertTrue(ended);
        assertEquals(RoomStatus.GAME_OVER, room.getStatus());
        assertSame(future, room.getPendingReset());
        verify(gameResponseSender).broadcastGameOver(room, NOW + LEADERBOARD_DURATION);
        verify(taskScheduler).schedule(any(Runnable.class), eq(Instant.ofEpochMilli(NOW + LEADERBOARD_DURATION)));
    }

    @Test
    @DisplayName("한 명이라도 ALIVE거나 방이 PLAYING이 아니면 종료하지 않는다")
    void checkAndEndGame_NotYet() {
        Room room = playingRoomAllDone();
        room.getPlayers().get(1).setStatus(PlayerStatus.ALIVE);
        assertFalse(gameFlowService.checkAndEndGame(room));

        room.getPlayers().get(1).setStatus(PlayerStatus.DEAD);
        room.setStatus(RoomStatus.LOBBY);
        assertFalse(gameFlowService.checkAndEndGame(room));

        verifyNoInteractions(gameResponseSender, taskScheduler);
    }

    @Test
    @DisplayName("GAME_OVER 이후 추가 보고가 와도 force_game_over는 한 번만 전송된다")
    void checkAndEndGame_OnlyOnce() {
        Room room = playingRoomAllDone();

        gameFlowService.checkAndEndGame(room);
        gameFlowService.checkAndEndGame(room);

        verify(gameResponseSender, times(1)).broadcastGameOver(eq(room), anyLong());
        verify(taskScheduler, times(1)).schedule(any(Runnable.class), any(Instant.class));
    }

    // 리셋

    @Test
    @DisplayName("리셋이 실행되면 캡틴만 초기화되어 로비에 남고 나머지는 kicked를 받는다")
    void processReset_KeepsCaptain() {
        // given
        Room room = playingRoomAllDone();
        Player captain = room.getCaptain();
        captain.setScore(900);
        gameFlowService.checkAndEndGame(room);
        Runnable reset = captureScheduledReset();

        // when
        reset.run();

        // then
        assertEquals(RoomStatus.LOBBY, room.getStatus());
        assertEquals(List.of(captain), room.getPlayers());
        assertFalse(captain.isReady());
        assertEquals(0, captain.getScore());
        assertEquals(PlayerStatus.ALIVE, captain.getStatus());
        assertNull(room.getPendingReset());

        verify(lobbyResponseSender).sendKicked("sock-b", "R");
        verify(lobbyResponseSender, never()).sendKicked(eq("sock-a"), anyString());
        verify(lobbyResponseSender).broadcastRoomUpdate(room);
    }

    @Test
    @DisplayName("리셋 시점에 방이 삭제되었다면 아무것도 하지 않는다")
    void processReset_RoomDeleted_Aborts() {
        Room room = playingRoomAllDone();
        gameFlowService.checkAndEndGame(room);
        Runnable reset = captureScheduledReset();

        room.getPlayers().clear();
        roomRegistry.delete("R");
        reset.run();

        assertTrue(roomRegistry.findRoomById("R").isEmpty());
        verifyNoInteractions(lobbyResponseSender);
    }

    @Test
    @DisplayName("같은 ID로 새 방이 만들어졌다면 이전 방의 리셋은 새 방을 건드리지 않는다")
    void processReset_RoomReplaced_Aborts() {
        Room room = playingRoomAllDone();
        gameFlowService.checkAndEndGame(room);
        Runnable reset = captureScheduledReset();

        roomRegistry.delete("R");
        Room fresh = roomRegistry.getOrCreate("R");
        fresh.addPlayer(Player.join("sock-new", null));
        reset.run();

        assertEquals(1, fresh.getPlayerCount());
        assertEquals(RoomStatus.LOBBY, fresh.getStatus());
        verifyNoInteractions(lobbyResponseSender);
    }

    @Test
    @DisplayName("리셋 시점에 상태가 GAME_OVER가 아니면 중단한다")
    void processReset_StatusChanged_Aborts() {
        Room room = playingRoomAllDone();
        gameFlowService.checkAndEndGame(room);
        Runnable reset = captureScheduledReset();

        room.setStatus(RoomStatus.LOBBY);
        reset.run();

        assertEquals(2, room.getPlayerCount());
        verifyNoInteractions(lobbyResponseSender);
    }

    @Test
    @DisplayName("리셋이 락을 잡지 못하면 200ms 뒤 재예약하고, 최대 횟수를 넘기면 포기한다")
    void processReset_LockBusy_GivesUpAfterMaxAttempts() {
        // given
        Room room = playingRoomAllDone();
        room.setStatus(RoomStatus.GAME_OVER);
        RoomLockFacade busyFacade = mock(RoomLockFacade.class);
        doReturn(LockResult.timedOut("R")).when(busyFacade).execute(eq("R"), any(Supplier.class));
        GameFlowService flow = new GameFlowService(roomRegistry, busyFacade, gameResponseSender,
                lobbyResponseSender, taskScheduler, new MissionProperties(2, 3000L, LEADERBOARD_DURATION),
                Clock.fixed(Instant.ofEpochMilli(NOW), ZoneOffset.UTC));

        // when
        flow.processReset("R", room);
        for (int attempt = 1; attempt < GameFlowService.MAX_RESET_ATTEMPTS; attempt++) {
            ArgumentCaptor<Runnable> retryCaptor = ArgumentCaptor.forClass(Runnable.class);
            verify(taskScheduler, times(attempt)).schedule(retryCaptor.capture(), any(Instant.class));
            retryCaptor.getValue().run();
        }

        // then
        verify(busyFacade, times(GameFlowService.MAX_RESET_ATTEMPTS)).execute(eq("R"), any(Supplier.class));
        verify(taskScheduler, times(GameFlowService.MAX_RESET_ATTEMPTS - 1))
                .schedule(any(Runnable.class), eq(Instant.ofEpochMilli(NOW + 200L)));
        assertEquals(RoomStatus.GAME_OVER, room.getStatus());
        assertEquals(2, room.getPlayerCount());
        verifyNoInteractions(lobbyResponseSender);
    }

    @Test
    @DisplayName("리셋 시점에 방이 비어 있으면 방을 삭제한다")
    void processReset_EmptyRoom_Deletes() {
        Room room = playingRoomAllDone();
        gameFlowService.checkAndEndGame(room);
        Runnable reset = captureScheduledReset();

        room.getPlayers().clear();
        reset.run();

        assertTrue(roomRegistry.findRoomById("R").isEmpty());
        verifyNoInteractions(lobbyResponseSender);
    }
}
