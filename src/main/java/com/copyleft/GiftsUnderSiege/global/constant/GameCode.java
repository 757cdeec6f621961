package com.copyleft.GiftsUnderSiege.global.constant;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public enum GameCode {

    GAME_STARTED("게임이 시작되었습니다."),
    GAME_REMOVED("게임이 정리되었습니다."),

    LAND_PLAYED("대지를 냈습니다."),
    GIFT_CLAIMED("선물을 획득했습니다."),
    GIFT_STOLEN("선물을 훔쳤습니다."),
    GIFT_WRAPPED("선물을 포장했습니다."),
    BUILDING_BUILT("건물을 지었습니다."),
    CARDS_RECYCLED("카드를 재활용했습니다. 한 장을 버려주세요."),
    CARD_DISCARDED("카드를 버렸습니다."),
    TURN_ENDED("턴이 넘어갔습니다.");

    private final String message;
}
