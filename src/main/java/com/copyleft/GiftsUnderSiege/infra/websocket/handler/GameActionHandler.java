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
public class GameActionHandler implements WebSocketCommandHandler {

    private final GameService gameService;
    private final ObjectMapper objectMapper;

    @Override
    public String getAction() {
        return "GAME_ACTION";
    }

    @Override
    public void handle(WebSocketSession session, JsonNode payload) {
        try {
            GameRequests.GameActionRequest dto = objectMapper.treeToValue(payload, GameRequests.GameActionRequest.class);
            if (dto != null) {
                gameService.handleAction(session.getId(), dto.getGameId(), dto.getAction(), dto.getPayload());
            }
        } catch (Exception e) {
            log.error("[GAME_ACTION] 처리 중 오류: session={}, msg={}", session.getId(), e.getMessage(), e);
        }
    }
}
