package com.copyleft.GiftsUnderSiege.domain;

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
public class TurnState {

    private String playerId;      // 현재 턴 주인
    private int number;           // 1부터 증가

    private boolean landPlayed;   // 이번 턴 대지 사용 여부
    private boolean actionTaken;  // 이번 턴 메인 액션 사용 여부

    public static TurnState first(String playerId) {
        return TurnState.builder()
                .playerId(playerId)
                .number(1)
                .build();
    }

    public void passTo(String nextPlayerId) {
        this.playerId = nextPlayerId;
        this.number++;
        this.landPlayed = false;
        this.actionTaken = false;
    }
}
