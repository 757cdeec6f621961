package com.copyleft.GiftsUnderSiege.feature.game;

import com.copyleft.GiftsUnderSiege.domain.GameSession;
import com.copyleft.GiftsUnderSiege.feature.game.dto.ActionResult;
import com.copyleft.GiftsUnderSiege.feature.game.dto.GameCommand;
import com.copyleft.GiftsUnderSiege.feature.game.dto.GameRequests;
import com.copyleft.GiftsUnderSiege.global.constant.ErrorCode;
import com.copyleft.GiftsUnderSiege.global.constant.GameCode;
import com.copyleft.GiftsUnderSiege.global.exception.GameRuleException;
import com.copyleft.GiftsUnderSiege.global.util.RandomUtil;
import com.copyleft.GiftsUnderSiege.infra.persistence.GameSessionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * 게임 상태 저장소 + 게임별 락.
 * 생성/액션/삭제는 같은 게임 락 안에서 하나씩 실행되고,
 * 락 안에서 불러온 사본을 변경 후 저장한다. 실패하면 저장하지 않는다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GameSessionRegistry {

    private final GameSessionRepository gameSessionRepository;
    private final GameLockFacade lockFacade;
    private final GameSetupFactory gameSetupFactory;
    private final GameActionDispatcher actionDispatcher;

    public GameSession create(String roomId, List<GameRequests.PlayerEntry> players) {
        String gameId = RandomUtil.generateId();

        LockResult<GameSession> result = lockFacade.execute(gameId, () -> {
            GameSession session = gameSetupFactory.create(gameId, roomId, players);
            gameSessionRepository.saveSession(session);
            gameSessionRepository.saveRoomGameMapping(roomId, gameId);
            return session;
        });

        if (!result.isSuccess()) {
            log.error("게임 생성 실패: roomId={}, status={}", roomId, result.getStatus());
            throw new GameRuleException(ErrorCode.GAME_BUSY);
        }
        log.info("게임 생성 완료: gameId={}, roomId={}, players={}", gameId, roomId, players.size());
        return result.getData();
    }

    public ActionResult applyAction(String gameId, String requesterId, GameCommand command) {
        LockResult<ActionResult> result = lockFacade.execute(gameId, () -> {
            GameSession session = gameSessionRepository.findSessionById(gameId)
                    .orElseThrow(() -> new GameRuleException(ErrorCode.GAME_NOT_FOUND));
            try {
                GameCode code = actionDispatcher.dispatch(session, requesterId, command);
                gameSessionRepository.saveSession(session);
                return new ActionResult(session, code);
            } catch (GameRuleException e) {
                if (e.isTerminal()) {
                    commitEnded(gameId);
                }
                throw e;
            }
        });

        if (result.isLockFailed()) {
            throw new GameRuleException(ErrorCode.GAME_BUSY);
        }
        return result.getData();
    }

    /**
     * 락 없이 저장된 사본을 읽는다. 저장은 락 안에서 통째로 이루어지므로 반쯤 바뀐 상태는 보이지 않는다.
     */
    public Optional<GameSession> find(String gameId) {
        return gameSessionRepository.findSessionById(gameId);
    }

    /**
     * 이미 없는 게임이어도 오류 없이 끝난다.
     */
    public Optional<GameSession> remove(String gameId) {
        LockResult<GameSession> result = lockFacade.execute(gameId, () -> {
            Optional<GameSession> existing = gameSessionRepository.findSessionById(gameId);
            existing.ifPresent(session -> gameSessionRepository.deleteRoomGameMapping(session.getRoomId()));
            gameSessionRepository.deleteSession(gameId);
            return existing.orElse(null);
        });

        if (result.isLockFailed()) {
            throw new GameRuleException(ErrorCode.GAME_BUSY);
        }
        if (result.isSuccess()) {
            log.info("게임 삭제: gameId={}", gameId);
        }
        return Optional.ofNullable(result.getData());
    }

    public Optional<GameSession> removeByRoomId(String roomId) {
        String gameId = gameSessionRepository.findGameIdByRoomId(roomId);
        if (gameId == null) {
            return Optional.empty();
        }
        return remove(gameId);
    }

    // 실패한 액션의 변경분은 버리고 종료 상태만 반영한다
    private void commitEnded(String gameId) {
        gameSessionRepository.findSessionById(gameId).ifPresent(fresh -> {
            fresh.end();
            gameSessionRepository.saveSession(fresh);
            log.info("게임 종료 저장: gameId={}", gameId);
        });
    }
}
