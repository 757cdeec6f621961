package com.copyleft.GiftsUnderSiege.feature.game.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Arrays;
import java.util.Optional;

@Getter
@AllArgsConstructor
public enum GameActionType {
    PLAY_LAND("play_land"),
    CLAIM_GIFT("claim_gift"),
    STEAL_GIFT("steal_gift"),
    WRAP_GIFT("wrap_gift"),
    BUILD_BUILDING("build_building"),
    RECYCLE("recycle"),
    DISCARD("discard"),
    END_TURN("end_turn");

    private final String actionName; // 클라이언트가 보내는 이름

    public static Optional<GameActionType> fromActionName(String actionName) {
        return Arrays.stream(values())
                .filter(type -> type.actionName.equals(actionName))
                .findFirst();
    }
}
