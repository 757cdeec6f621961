package com.copyleft.GiftsUnderSiege.domain;

import com.copyleft.GiftsUnderSiege.domain.type.BuildingType;
import com.copyleft.GiftsUnderSiege.domain.type.LandColor;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;
import lombok.extern.jackson.Jacksonized;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

@Getter
@Setter
@Builder
@Jacksonized
@NoArgsConstructor
@AllArgsConstructor
@ToString
public class Player {

    private String memberId; // 접속 세션 ID
    private String name;     // 표시용 이름

    @Builder.Default
    private List<LandColor> hand = new ArrayList<>();

    @Builder.Default
    private List<LandInPlay> landsInPlay = new ArrayList<>();

    @Builder.Default
    private List<Gift> gifts = new ArrayList<>();

    private BuildingType building; // 한 번 지으면 변경 불가

    @Builder.Default
    private int pendingDiscard = 0;

    public static Player join(String memberId, String name) {
        return Player.builder()
                .memberId(memberId)
                .name(name)
                .build();
    }

    @JsonIgnore
    public int getScore() {
        return gifts.stream()
                .mapToInt(gift -> gift.getGiftClass().getScore())
                .sum();
    }

    @JsonIgnore
    public long getTappedLandCount() {
        return landsInPlay.stream().filter(LandInPlay::isTapped).count();
    }

    public boolean hasBuilding(BuildingType type) {
        return this.building == type;
    }

    public Optional<Gift> findGift(String giftId) {
        return gifts.stream()
                .filter(g -> Objects.equals(g.getGiftId(), giftId))
                .findFirst();
    }

    public void removeGift(String giftId) {
        gifts.removeIf(g -> Objects.equals(g.getGiftId(), giftId));
    }

    public void untapAll() {
        for (LandInPlay land : landsInPlay) {
            land.setTapped(false);
        }
    }

    public boolean isValidHandIndex(int index) {
        return index >= 0 && index < hand.size();
    }
}
