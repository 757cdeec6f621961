package com.copyleft.GiftsUnderSiege.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "game.rule")
public record GameProperties(
        // 게임 준비
        int giftsInDisplay,    // 전시되는 선물 수 (기본 8)
        int initialHand,       // 시작 손패 (기본 5)
        int deckSizePerColor,  // 색상별 대지 장수 (기본 12)
        int giftPoolSize,      // 생성할 선물 풀 크기 (기본 24)
        int minPlayerCount,    // 최소 인원

        // 게임 룰
        int handLimit,         // 턴 종료 시 손패 상한 (기본 7)
        int landLimit          // 전장 대지 상한 (기본 10)
) {}
