package com.copyleft.GiftsUnderSiege.domain.type;

import com.copyleft.GiftsUnderSiege.domain.vo.ManaCost;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Arrays;
import java.util.Optional;

@Getter
@AllArgsConstructor
public enum BuildingType {
    THIEFS_GLOVES("thiefs_gloves", LandColor.BLACK),          // 훔칠 때 버리는 카드 -2
    CROWBAR("crowbar", LandColor.RED),                        // 훔칠 때 자물쇠 +1 가능
    REINFORCED_RIBBON("reinforced_ribbon", LandColor.GREEN),  // 포장 시 자물쇠 +2
    SUPPLY_WAREHOUSE("supply_warehouse", LandColor.BLUE);     // 재활용 시 2장 드로우

    public static final int TOTAL_COST = 4;
    public static final int COLOR_COST = 2;

    private final String code;
    private final LandColor color;

    public ManaCost cost() {
        return ManaCost.ofColor(TOTAL_COST, COLOR_COST, color);
    }

    public static Optional<BuildingType> fromCode(String code) {
        return Arrays.stream(values())
                .filter(type -> type.code.equals(code))
                .findFirst();
    }
}
