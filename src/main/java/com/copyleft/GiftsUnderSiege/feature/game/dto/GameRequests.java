package com.copyleft.GiftsUnderSiege.feature.game.dto;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.List;

public class GameRequests {

    // 방에서 게임 시작 (START_GAME)
    @Getter
    @NoArgsConstructor
    @AllArgsConstructor
    public static class StartGameRequest {
        private String roomId;
        private List<PlayerEntry> players;
    }

    @Getter
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PlayerEntry {
        private String memberId;
        private String name;
    }

    // 게임 액션 (GAME_ACTION)
    @Getter
    @NoArgsConstructor
    @AllArgsConstructor
    public static class GameActionRequest {
        private String gameId;
        private String action;
        private JsonNode payload;
    }

    // 게임 상태 요청 (GET_GAME_STATE)
    @Getter
    @NoArgsConstructor
    @AllArgsConstructor
    public static class GameStateRequest {
        private String gameId;
    }

    // 방 해산 (END_GAME)
    @Getter
    @NoArgsConstructor
    @AllArgsConstructor
    public static class EndGameRequest {
        private String roomId;
    }
}
