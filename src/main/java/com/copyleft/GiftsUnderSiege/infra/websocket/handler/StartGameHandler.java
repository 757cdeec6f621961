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
public class StartGameHandler implements WebSocketCommandHandler {

    private final GameService gameService;
    private final ObjectMapper objectMapper;

    @Override
    public String getAction() {
        return "START_GAME";
    }

    @Override
    public void handle(WebSocketSession session, JsonNode payload) {
        try {
            GameRequests.StartGameRequest dto = objectMapper.treeToValue(payload, GameRequests.StartGameRequest.class);
            if (dto != null) {
                gameService.startGame(session.getId(), dto.getRoomId(), dto.getPlayers());
            }
        } catch (Exception e) {
            log.error("[START_GAME] 처리 중 오류: session={}, msg={}", session.getId(), e.getMessage(), e);
        }
    }
}
