package com.copyleft.GiftsUnderSiege.global.constant;

public enum SocketEvent {
    GAME_STARTED,   // 게임 시작 (개인별 스냅샷)
    GAME_STATE,     // 액션 이후 상태 (개인별 스냅샷)
    GAME_REMOVED,   // 방 해산으로 게임 정리

    GAME_ERROR      // 룰 위반 (요청자에게만)
}
