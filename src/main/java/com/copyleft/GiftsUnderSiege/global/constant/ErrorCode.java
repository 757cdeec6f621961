package com.copyleft.GiftsUnderSiege.global.constant;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public enum ErrorCode {

    GAME_NOT_FOUND("존재하지 않는 게임입니다."),
    GAME_ENDED("이미 종료된 게임입니다."),
    GAME_BUSY("다른 요청을 처리 중입니다. 잠시 후 다시 시도해주세요."),
    PLAYER_NOT_FOUND("게임에 참여하지 않은 플레이어입니다."),
    NOT_ENOUGH_PLAYERS("게임을 시작할 플레이어가 부족합니다."),

    NOT_YOUR_TURN("당신의 턴이 아닙니다."),
    ACTION_ALREADY_TAKEN("이번 턴에 이미 메인 액션을 사용했습니다."),

    LAND_ALREADY_PLAYED("이번 턴에 이미 대지를 냈습니다."),
    LAND_LIMIT_REACHED("더 이상 대지를 낼 수 없습니다."),
    INVALID_HAND_INDEX("잘못된 카드 선택입니다."),

    GIFT_NOT_AVAILABLE("전시 중인 선물이 아닙니다."),
    GIFT_NOT_FOUND("선물을 찾을 수 없습니다."),
    NOT_YOUR_GIFT("당신의 선물이 아닙니다."),
    GIFT_SEALED("봉인된 선물은 훔칠 수 없습니다."),
    CANNOT_STEAL_OWN_GIFT("다른 플레이어의 선물만 훔칠 수 있습니다."),

    INSUFFICIENT_MANA("탭하지 않은 대지가 부족합니다."),
    INSUFFICIENT_COLOR("필요한 색상의 대지가 부족합니다."),
    INSUFFICIENT_HAND_FOR_DISCARD("자물쇠 비용으로 버릴 손패가 부족합니다."),
    INVALID_DISCARD_SELECTION("버릴 카드 선택이 올바르지 않습니다."),

    BUILDING_ALREADY_BUILT("이미 건물을 지었습니다."),
    UNKNOWN_BUILDING("알 수 없는 건물입니다."),

    DISCARD_REQUIRED("턴을 마치기 전에 카드를 버려야 합니다."),
    DISCARD_ALREADY_PENDING("재활용하기 전에 카드를 먼저 버려야 합니다."),
    NO_DISCARD_PENDING("버려야 할 카드가 없습니다."),

    DECK_EMPTY("덱이 모두 소진되어 게임이 종료되었습니다."),

    UNKNOWN_ACTION("알 수 없는 액션입니다."),
    INVALID_PAYLOAD("요청 형식이 올바르지 않습니다."),

    UNKNOWN_ERROR("알 수 없는 오류가 발생했습니다.");

    private final String message;
}
