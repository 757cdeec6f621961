package com.copyleft.GiftsUnderSiege.domain.type;

import com.copyleft.GiftsUnderSiege.domain.vo.ManaCost;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public enum GiftClass {
    CLASS_I("I", 1, 3, 2, 5),
    CLASS_II("II", 2, 5, 3, 3),
    CLASS_III("III", 3, 7, 4, 2);

    private final String code;
    private final int score;      // 점수 가치
    private final int totalCost;  // 필요한 대지 수
    private final int colorCost;  // 그 중 선물 색상이어야 하는 수
    private final int weight;     // 선물 풀 생성 가중치

    public ManaCost costFor(LandColor color) {
        return ManaCost.ofColor(totalCost, colorCost, color);
    }
}
