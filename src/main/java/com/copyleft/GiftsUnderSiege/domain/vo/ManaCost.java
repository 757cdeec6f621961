package com.copyleft.GiftsUnderSiege.domain.vo;

import com.copyleft.GiftsUnderSiege.domain.type.LandColor;

/**
 * 대지를 탭해서 지불하는 비용.
 * color 가 null 이면 색상 조건 없음.
 */
public record ManaCost(int total, int colorAmount, LandColor color) {

    public static final ManaCost WRAP = of(2);

    public static ManaCost of(int total) {
        return new ManaCost(total, 0, null);
    }

    public static ManaCost ofColor(int total, int colorAmount, LandColor color) {
        return new ManaCost(total, colorAmount, color);
    }

    public boolean requiresColor() {
        return color != null && colorAmount > 0;
    }
}
