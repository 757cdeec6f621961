package com.copyleft.GiftsUnderSiege.domain;

import com.copyleft.GiftsUnderSiege.domain.type.GiftClass;
import com.copyleft.GiftsUnderSiege.domain.type.LandColor;
import com.fasterxml.jackson.annotation.JsonIgnore;
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
public class Gift {

    public static final int MAX_LOCKS = 5;

    private String giftId;
    private LandColor color;
    private GiftClass giftClass;

    @Builder.Default
    private int locks = 0;

    private String ownerId; // null 이면 전시 중

    /**
     * 자물쇠를 추가한다. 최대치(5)를 넘지 않는다.
     */
    public void addLocks(int count) {
        this.locks = Math.min(MAX_LOCKS, this.locks + count);
    }

    // 자물쇠 5개 = 봉인 (훔칠 수 없음)
    @JsonIgnore
    public boolean isSealed() {
        return this.locks >= MAX_LOCKS;
    }
}
