package com.copyleft.GiftsUnderSiege.domain;

import com.copyleft.GiftsUnderSiege.domain.type.GameStatus;
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
public class GameSession {

    private String gameId;   // 내부 관리용 UUID
    private String roomId;   // 게임을 시작한 방

    @Builder.Default
    private long createdAt = System.currentTimeMillis();

    @Builder.Default
    private GameStatus status = GameStatus.ACTIVE;

    // 리스트 순서 = 턴 순서
    @Builder.Default
    private List<Player> players = new ArrayList<>();

    // 앞에서부터 뽑는다
    @Builder.Default
    private List<LandColor> deck = new ArrayList<>();

    @Builder.Default
    private List<Gift> giftsDisplay = new ArrayList<>();

    private TurnState turn;

    @JsonIgnore
    public boolean isActive() {
        return this.status == GameStatus.ACTIVE;
    }

    public void end() {
        this.status = GameStatus.ENDED;
    }

    public Optional<Player> findPlayer(String memberId) {
        return players.stream()
                .filter(p -> Objects.equals(p.getMemberId(), memberId))
                .findFirst();
    }

    @JsonIgnore
    public Player getCurrentPlayer() {
        return findPlayer(turn.getPlayerId())
                .orElseThrow(() -> new IllegalStateException("Turn owner is not a player: " + turn.getPlayerId()));
    }

    public Optional<Gift> findDisplayGift(String giftId) {
        return giftsDisplay.stream()
                .filter(g -> Objects.equals(g.getGiftId(), giftId))
                .findFirst();
    }

    public void removeDisplayGift(String giftId) {
        giftsDisplay.removeIf(g -> Objects.equals(g.getGiftId(), giftId));
    }

    // 선물을 가진 플레이어를 찾는다 (전시 중인 선물은 해당 없음)
    public Optional<Player> findGiftOwner(String giftId) {
        return players.stream()
                .filter(p -> p.findGift(giftId).isPresent())
                .findFirst();
    }

    public int indexOfPlayer(String memberId) {
        for (int i = 0; i < players.size(); i++) {
            if (Objects.equals(players.get(i).getMemberId(), memberId)) {
                return i;
            }
        }
        return -1;
    }
}
