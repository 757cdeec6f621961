package com.copyleft.GiftsUnderSiege.infra.websocket.handler;

import com.copyleft.GiftsUnderSiege.feature.game.GameService;
import com.copyleft.GiftsUnderSiege.feature.game.dto.GameRequests;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.WebSocketSession;

@Slf4j
@Component
@RequiredArgsConstructor
public class GetGameStateHandler implements WebSocketCommandHandler {

    private final GameService gameService;
    private final ObjectMapper objectMapper;

    @Override
    public String getAction() {
        return "GET_GAME_STATE";
    }

    @Override
    public void handle(WebSocketSession session, JsonNode payload) {
        try {
            GameRequests.GameStateRequest dto = objectMapper.treeToValue(payload, GameRequests.GameStateRequest.class);
            gameService.sendGameState(session.getId(), dto != null ? dto.getGameId() : null);
        } catch (Exception e) {
            log.error("[GET_GAME_STATE] 처리 중 오류: session={}, msg={}", session.getId(), e.getMessage(), e);
        }
    }
}
