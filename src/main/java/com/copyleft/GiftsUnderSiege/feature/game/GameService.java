package com.copyleft.GiftsUnderSiege.feature.game;

import com.copyleft.GiftsUnderSiege.domain.GameSession;
import com.copyleft.GiftsUnderSiege.feature.game.dto.ActionResult;
import com.copyleft.GiftsUnderSiege.feature.game.dto.GameCommand;
import com.copyleft.GiftsUnderSiege.feature.game.dto.GameRequests;
import com.copyleft.GiftsUnderSiege.global.constant.ErrorCode;
import com.copyleft.GiftsUnderSiege.global.constant.GameCode;
import com.copyleft.GiftsUnderSiege.global.constant.SocketEvent;
import com.copyleft.GiftsUnderSiege.global.exception.GameRuleException;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.List;
import java.util.Optional;

/**
 * 전송 계층의 진입점. 변경은 레지스트리(락) 안에서 끝나고,
 * 스냅샷 전송은 락이 풀린 뒤에 한다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GameService {

    private final GameSessionRegistry sessionRegistry;
    private final GameActionParser actionParser;
    private final GameResponseSender responseSender;

    public void startGame(String sessionId, String roomId, List<GameRequests.PlayerEntry> players) {
        if (!StringUtils.hasText(roomId)) {
            responseSender.sendError(sessionId, ErrorCode.INVALID_PAYLOAD);
            return;
        }

        try {
            GameSession session = sessionRegistry.create(roomId, players);
            responseSender.broadcastGameState(session, SocketEvent.GAME_STARTED, GameCode.GAME_STARTED);
        } catch (GameRuleException e) {
            log.warn("게임 시작 실패: roomId={}, code={}", roomId, e.getErrorCode());
            responseSender.sendError(sessionId, e.getErrorCode());
        }
    }

    public void handleAction(String sessionId, String gameId, String actionName, JsonNode payload) {
        if (!StringUtils.hasText(gameId)) {
            responseSender.sendError(sessionId, ErrorCode.INVALID_PAYLOAD);
            return;
        }

        try {
            GameCommand command = actionParser.parse(actionName, payload);
            ActionResult result = sessionRegistry.applyAction(gameId, sessionId, command);
            responseSender.broadcastGameState(result.session(), SocketEvent.GAME_STATE, result.code());
        } catch (GameRuleException e) {
            log.info("룰 위반: gameId={}, session={}, action={}, code={}", gameId, sessionId, actionName, e.getErrorCode());
            responseSender.sendError(sessionId, e.getErrorCode());

            if (e.isTerminal()) {
                // 덱 소진: 모두에게 종료된 상태를 알린다
                sessionRegistry.find(gameId).ifPresent(session ->
                        responseSender.broadcastGameState(session, SocketEvent.GAME_STATE, ErrorCode.DECK_EMPTY.getMessage()));
            }
        } catch (RuntimeException e) {
            log.error("액션 처리 중 알 수 없는 오류: gameId={}, session={}, action={}", gameId, sessionId, actionName, e);
            responseSender.sendError(sessionId, ErrorCode.UNKNOWN_ERROR);
        }
    }

    public void sendGameState(String sessionId, String gameId) {
        Optional<GameSession> session = StringUtils.hasText(gameId) ? sessionRegistry.find(gameId) : Optional.empty();
        if (session.isEmpty()) {
            responseSender.sendError(sessionId, ErrorCode.GAME_NOT_FOUND);
            return;
        }

        try {
            responseSender.sendGameState(sessionId, session.get(), SocketEvent.GAME_STATE, null);
        } catch (GameRuleException e) {
            responseSender.sendError(sessionId, e.getErrorCode());
        }
    }

    public void removeGameForRoom(String sessionId, String roomId) {
        if (!StringUtils.hasText(roomId)) {
            responseSender.sendError(sessionId, ErrorCode.INVALID_PAYLOAD);
            return;
        }

        try {
            sessionRegistry.removeByRoomId(roomId).ifPresent(responseSender::broadcastGameRemoved);
        } catch (GameRuleException e) {
            log.warn("게임 삭제 실패: roomId={}, code={}", roomId, e.getErrorCode());
            responseSender.sendError(sessionId, e.getErrorCode());
        }
    }
}
