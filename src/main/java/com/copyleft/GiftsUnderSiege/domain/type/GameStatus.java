package com.copyleft.GiftsUnderSiege.domain.type;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public enum GameStatus {
    ACTIVE("active"),
    ENDED("ended"); // 덱 소진 시 (되돌릴 수 없음)

    private final String code;
}
