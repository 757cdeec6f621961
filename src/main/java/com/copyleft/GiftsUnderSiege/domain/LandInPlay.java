package com.copyleft.GiftsUnderSiege.domain;

import com.copyleft.GiftsUnderSiege.domain.type.LandColor;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;
import lombok.extern.jackson.Jacksonized;

@Getter
@Setter
@Builder
@Jacksonized
@NoArgsConstructor
@AllArgsConstructor
@ToString
public class LandInPlay {

    private LandColor color;
    private boolean tapped;

    public static LandInPlay untapped(LandColor color) {
        return LandInPlay.builder()
                .color(color)
                .tapped(false)
                .build();
    }
}
