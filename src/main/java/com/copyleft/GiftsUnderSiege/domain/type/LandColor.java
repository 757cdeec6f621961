package com.copyleft.GiftsUnderSiege.domain.type;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public enum LandColor {
    WHITE("W"),
    BLUE("U"),
    BLACK("B"),
    RED("R"),
    GREEN("G");

    private final String code; // 화면 표시용 한 글자 코드
}
