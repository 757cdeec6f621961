package com.copyleft.GiftsUnderSiege.feature.game;

import com.copyleft.GiftsUnderSiege.domain.GameSession;
import com.copyleft.GiftsUnderSiege.domain.type.GameStatus;
import com.copyleft.GiftsUnderSiege.feature.game.dto.ActionResult;
import com.copyleft.GiftsUnderSiege.feature.game.dto.GameCommand;
import com.copyleft.GiftsUnderSiege.feature.game.dto.GameRequests;
import com.copyleft.GiftsUnderSiege.global.constant.ErrorCode;
import com.copyleft.GiftsUnderSiege.global.constant.GameCode;
import com.copyleft.GiftsUnderSiege.global.exception.GameRuleException;
import com.copyleft.GiftsUnderSiege.infra.persistence.GameSessionRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

import static com.copyleft.GiftsUnderSiege.feature.game.GameFixtures.P1;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class GameSessionRegistryTest {

    @InjectMocks
    private GameSessionRegistry registry;

    @Mock private GameSessionRepository gameSessionRepository;
    @Mock private GameLockFacade lockFacade;
    @Mock private GameSetupFactory gameSetupFactory;
    @Mock private GameActionDispatcher actionDispatcher;

    // 락을 잡은 것처럼 바로 실행
    @SuppressWarnings("unchecked")
    private void runLockInline() {
        doAnswer(invocation -> {
            Supplier<Object> action = invocation.getArgument(1);
            Object result = action.get();
            return result == null ? LockResult.skipped() : LockResult.success(result);
        }).when(lockFacade).execute(anyString(), any(Supplier.class));
    }

    @Test
    @DisplayName("게임 생성 시 상태와 방 매핑을 저장한다")
    void create_SavesSessionAndMapping() {
        // given
        runLockInline();
        List<GameRequests.PlayerEntry> entries = List.of(new GameRequests.PlayerEntry(P1, "하나"));
        GameSession session = GameFixtures.twoPlayerGame(5);
        when(gameSetupFactory.create(anyString(), eq("room-1"), eq(entries))).thenReturn(session);

        // when
        GameSession created = registry.create("room-1", entries);

        // then
        assertSame(session, created);
        verify(gameSessionRepository).saveSession(session);
        verify(gameSessionRepository).saveRoomGameMapping(eq("room-1"), anyString());
    }

    @Test
    @DisplayName("액션이 성공하면 변경된 사본을 저장하고 결과를 돌려준다")
    void applyAction_Success_Saves() {
        // given
        runLockInline();
        GameSession session = GameFixtures.twoPlayerGame(5);
        GameCommand command = new GameCommand.EndTurn();
        when(gameSessionRepository.findSessionById("game-1")).thenReturn(Optional.of(session));
        when(actionDispatcher.dispatch(session, P1, command)).thenReturn(GameCode.TURN_ENDED);

        // when
        ActionResult result = registry.applyAction("game-1", P1, command);

        // then
        assertSame(session, result.session());
        assertEquals(GameCode.TURN_ENDED, result.code());
        verify(gameSessionRepository).saveSession(session);
    }

    @Test
    @DisplayName("룰 위반이면 아무것도 저장하지 않는다")
    void applyAction_RuleViolation_NoSave() {
        // given
        runLockInline();
        GameSession session = GameFixtures.twoPlayerGame(5);
        GameCommand command = new GameCommand.Recycle();
        when(gameSessionRepository.findSessionById("game-1")).thenReturn(Optional.of(session));
        when(actionDispatcher.dispatch(session, P1, command))
                .thenThrow(new GameRuleException(ErrorCode.ACTION_ALREADY_TAKEN));

        // when
        GameRuleException ex = assertThrows(GameRuleException.class,
                () -> registry.applyAction("game-1", P1, command));

        // then
        assertEquals(ErrorCode.ACTION_ALREADY_TAKEN, ex.getErrorCode());
        verify(gameSessionRepository, never()).saveSession(any());
    }

    @Test
    @DisplayName("덱 소진이면 변경분은 버리고 새 사본에 종료 상태만 저장한다")
    void applyAction_DeckEmpty_CommitsEndedOnly() {
        // given
        runLockInline();
        GameSession working = GameFixtures.twoPlayerGame(0);
        GameSession fresh = GameFixtures.twoPlayerGame(0);
        GameCommand command = new GameCommand.EndTurn();
        when(gameSessionRepository.findSessionById("game-1"))
                .thenReturn(Optional.of(working))
                .thenReturn(Optional.of(fresh));
        when(actionDispatcher.dispatch(working, P1, command))
                .thenThrow(new GameRuleException(ErrorCode.DECK_EMPTY));

        // when
        GameRuleException ex = assertThrows(GameRuleException.class,
                () -> registry.applyAction("game-1", P1, command));

        // then
        assertTrue(ex.isTerminal());
        assertEquals(GameStatus.ENDED, fresh.getStatus());
        verify(gameSessionRepository).saveSession(fresh);
        verify(gameSessionRepository, never()).saveSession(working);
    }

    @Test
    @DisplayName("없는 게임이면 GAME_NOT_FOUND")
    void applyAction_NotFound() {
        runLockInline();
        when(gameSessionRepository.findSessionById("ghost")).thenReturn(Optional.empty());

        GameRuleException ex = assertThrows(GameRuleException.class,
                () -> registry.applyAction("ghost", P1, new GameCommand.EndTurn()));

        assertEquals(ErrorCode.GAME_NOT_FOUND, ex.getErrorCode());
        verifyNoInteractions(actionDispatcher);
    }

    @Test
    @DisplayName("락을 잡지 못하면 GAME_BUSY")
    void applyAction_LockFailed() {
        when(lockFacade.execute(anyString(), any(Supplier.class))).thenReturn(LockResult.lockFailed());

        GameRuleException ex = assertThrows(GameRuleException.class,
                () -> registry.applyAction("game-1", P1, new GameCommand.EndTurn()));

        assertEquals(ErrorCode.GAME_BUSY, ex.getErrorCode());
        verifyNoInteractions(gameSessionRepository, actionDispatcher);
    }

    @Test
    @DisplayName("삭제는 이미 없는 게임이어도 오류 없이 끝난다")
    void remove_Idempotent() {
        runLockInline();
        when(gameSessionRepository.findSessionById("ghost")).thenReturn(Optional.empty());

        Optional<GameSession> removed = registry.remove("ghost");

        assertTrue(removed.isEmpty());
        verify(gameSessionRepository).deleteSession("ghost");
        verify(gameSessionRepository, never()).deleteRoomGameMapping(anyString());
    }

    @Test
    @DisplayName("방 ID 로 삭제하면 매핑과 상태를 함께 지운다")
    void removeByRoomId_DeletesBoth() {
        runLockInline();
        GameSession session = GameFixtures.twoPlayerGame(5);
        when(gameSessionRepository.findGameIdByRoomId("room-1")).thenReturn("game-1");
        when(gameSessionRepository.findSessionById("game-1")).thenReturn(Optional.of(session));

        Optional<GameSession> removed = registry.removeByRoomId("room-1");

        assertSame(session, removed.orElseThrow());
        verify(gameSessionRepository).deleteRoomGameMapping("room-1");
        verify(gameSessionRepository).deleteSession("game-1");
    }

    @Test
    @DisplayName("방에 연결된 게임이 없으면 락 없이 끝난다")
    void removeByRoomId_NoMapping() {
        when(gameSessionRepository.findGameIdByRoomId("room-1")).thenReturn(null);

        assertTrue(registry.removeByRoomId("room-1").isEmpty());
        verifyNoInteractions(lockFacade);
    }
}
