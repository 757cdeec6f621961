package com.copyleft.GiftsUnderSiege.feature.game;

import com.copyleft.GiftsUnderSiege.domain.GameSession;
import com.copyleft.GiftsUnderSiege.domain.Player;
import com.copyleft.GiftsUnderSiege.feature.game.dto.GamePayloads;
import com.copyleft.GiftsUnderSiege.global.constant.ErrorCode;
import com.copyleft.GiftsUnderSiege.global.constant.GameCode;
import com.copyleft.GiftsUnderSiege.global.constant.SocketEvent;
import com.copyleft.GiftsUnderSiege.infra.websocket.WebSocketSender;
import com.copyleft.GiftsUnderSiege.infra.websocket.dto.WebSocketResponse;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class GameResponseSender {

    private final WebSocketSender webSocketSender;
    private final GameStateProjector gameStateProjector;

    // 플레이어마다 자기 시점의 스냅샷을 보낸다
    public void broadcastGameState(GameSession session, SocketEvent event, String message) {
        for (Player player : session.getPlayers()) {
            sendGameState(player.getMemberId(), session, event, message);
        }
    }

    public void broadcastGameState(GameSession session, SocketEvent event, GameCode code) {
        broadcastGameState(session, event, code.getMessage());
    }

    public void sendGameState(String sessionId, GameSession session, SocketEvent event, String message) {
        GamePayloads.GameStateView view = gameStateProjector.project(session, sessionId);

        WebSocketResponse<GamePayloads.GameStateView> response = WebSocketResponse.<GamePayloads.GameStateView>builder()
                .event(event.name())
                .message(message)
                .data(view)
                .build();

        webSocketSender.sendEventToSession(sessionId, response);
    }

    public void broadcastGameRemoved(GameSession session) {
        WebSocketResponse<Void> response = WebSocketResponse.<Void>builder()
                .event(SocketEvent.GAME_REMOVED.name())
                .message(GameCode.GAME_REMOVED.getMessage())
                .code(GameCode.GAME_REMOVED.name())
                .build();

        for (Player player : session.getPlayers()) {
            webSocketSender.sendEventToSession(player.getMemberId(), response);
        }
    }

    public void sendError(String sessionId, ErrorCode errorCode) {
        WebSocketResponse<Void> response = WebSocketResponse.<Void>builder()
                .event(SocketEvent.GAME_ERROR.name())
                .message(errorCode.getMessage())
                .code(errorCode.name())
                .build();
        webSocketSender.sendEventToSession(sessionId, response);
    }
}
