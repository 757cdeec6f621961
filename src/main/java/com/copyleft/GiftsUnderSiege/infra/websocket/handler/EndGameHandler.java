package com.copyleft.GiftsUnderSiege.infra.websocket.handler;

import com.copyleft.GiftsUnderSiege.feature.game.GameService;
import com.copyleft.GiftsUnderSiege.feature.game.dto.GameRequests;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.WebSocketSession;

// 방이 해산될 때 게임을 정리한다
@Slf4j
@Component
@RequiredArgsConstructor
public class EndGameHandler implements WebSocketCommandHandler {

    private final GameService gameService;
    private final ObjectMapper objectMapper;

    @Override
    public String getAction() {
        return "END_GAME";
    }

    @Override
    public void handle(WebSocketSession session, JsonNode payload) {
        try {
            GameRequests.EndGameRequest dto = objectMapper.treeToValue(payload, GameRequests.EndGameRequest.class);
            if (dto != null) {
                gameService.removeGameForRoom(session.getId(), dto.getRoomId());
            }
        } catch (Exception e) {
            log.error("[END_GAME] 처리 중 오류: session={}, msg={}", session.getId(), e.getMessage(), e);
        }
    }
}
