package com.copyleft.GiftsUnderSiege.global.constant;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public enum RedisKey {

    GAME("game:"),              // String (game:uuid) -> GameSession JSON
    ROOM_GAME("room_game:"),    // String (room_game:roomId) -> gameId
    GAME_LOCK("game-lock:");    // Redisson lock

    private final String prefix;

    public String makeKey(String identifier) {
        return this.prefix + identifier;
    }
}
