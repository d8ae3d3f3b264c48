package com.dka.MissionServer.feature.game;

import com.dka.MissionServer.domain.Player;
import com.dka.MissionServer.domain.Room;
import com.dka.MissionServer.domain.type.PlayerStatus;
import com.dka.MissionServer.domain.type.RoomStatus;
import com.dka.MissionServer.feature.game.dto.UpdatePlayerRequest;
import com.dka.MissionServer.global.constant.ErrorCode;
import com.dka.MissionServer.global.result.ActionResult;
import com.dka.MissionServer.infra.persistence.RoomRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class GamePlayServiceTest {

    @Mock private GameResponseSender gameResponseSender;
    @Mock private GameFlowService gameFlowService;

    private RoomRegistry roomRegistry;
    private GamePlayService gamePlayService;
    private Room room;

    @BeforeEach
    void setUp() {
        roomRegistry = new RoomRegistry();
        gamePlayService = new GamePlayService(roomRegistry, new RoomLockFacade(), gameResponseSender, gameFlowService);

        room = roomRegistry.getOrCreate("R");
        room.addPlayer(Player.join("sock-a", "A"));
        room.addPlayer(Player.join("sock-b", "B"));
        room.setStatus(RoomStatus.PLAYING);
    }

    @Test
    @DisplayName("점수와 상태를 그대로 덮어쓰고 보낸 사람 포함 전원에게 전송한 뒤 종료를 검사한다")
    void updatePlayer_Success() {
        // when
        ActionResult result = gamePlayService.updatePlayer("sock-b",
                new UpdatePlayerRequest("R", 420, PlayerStatus.DEAD));

        // then
        assertTrue(result.isSuccess());
        Player b = room.findPlayer("sock-b").orElseThrow();
        assertEquals(420, b.getScore());
        assertEquals(PlayerStatus.DEAD, b.getStatus());

        InOrder inOrder = inOrder(gameResponseSender, gameFlowService);
        inOrder.verify(gameResponseSender).broadcastPlayerUpdated(room, b);
        inOrder.verify(gameFlowService).checkAndEndGame(room);
    }

    @Test
    @DisplayName("점수가 줄어들거나 상태가 되돌아가도 검증 없이 반영한다")
    void updatePlayer_LastWriteWins() {
        gamePlayService.updatePlayer("sock-a", new UpdatePlayerRequest("R", 500, PlayerStatus.FINISHED));
        gamePlayService.updatePlayer("sock-a", new UpdatePlayerRequest("R", 10, PlayerStatus.ALIVE));

        Player a = room.getCaptain();
        assertEquals(10, a.getScore());
        assertEquals(PlayerStatus.ALIVE, a.getStatus());
    }

    @Test
    @DisplayName("방에 없는 플레이어의 보고는 무시된다")
    void updatePlayer_UnknownPlayer_Ignored() {
        ActionResult result = gamePlayService.updatePlayer("stranger",
                new UpdatePlayerRequest("R", 1, PlayerStatus.DEAD));

        assertEquals(ErrorCode.PLAYER_NOT_FOUND, result.getErrorCode());
        verifyNoInteractions(gameResponseSender, gameFlowService);
    }

    @Test
    @DisplayName("없는 방에 대한 보고는 무시된다")
    void updatePlayer_UnknownRoom_Ignored() {
        ActionResult result = gamePlayService.updatePlayer("sock-a",
                new UpdatePlayerRequest("NOPE", 1, PlayerStatus.DEAD));

        assertEquals(ErrorCode.ROOM_NOT_FOUND, result.getErrorCode());
        verifyNoInteractions(gameResponseSender, gameFlowService);
    }

    @Test
    @DisplayName("점수나 상태가 빠진 보고는 형식 오류로 무시된다")
    void updatePlayer_Malformed_Ignored() {
        assertEquals(ErrorCode.INVALID_REQUEST,
                gamePlayService.updatePlayer("sock-a", new UpdatePlayerRequest("R", null, PlayerStatus.DEAD)).getErrorCode());
        assertEquals(ErrorCode.INVALID_REQUEST,
                gamePlayService.updatePlayer("sock-a", new UpdatePlayerRequest("R", 5, null)).getErrorCode());
        assertEquals(ErrorCode.INVALID_REQUEST,
                gamePlayService.updatePlayer("sock-a", null).getErrorCode());

        assertEquals(0, room.getCaptain().getScore());
        verifyNoInteractions(gameResponseSender, gameFlowService);
    }
}
