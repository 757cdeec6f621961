package com.copyleft.GiftsUnderSiege.feature.game.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Builder;
import lombok.Getter;

import java.util.List;

/**
 * 클라이언트로 내려가는 게임 상태 스냅샷. 필드 이름은 snake_case 로 직렬화된다.
 */
public class GamePayloads {

    // 보는 사람마다 따로 만든 전체 스냅샷
    @Getter
    @Builder
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class GameStateView {
        private String gameId;
        private String roomId;
        private String status;
        private String createdAt;
        private TurnView turn;
        private List<PlayerView> players;
        private List<GiftView> giftsDisplay;
        private ViewerView viewer;
        private int deckCount;
    }

    @Getter
    @Builder
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class TurnView {
        private String playerId;
        private int number;
        private boolean hasPlayedLand;
        private boolean hasTakenAction;
    }

    // 공개 정보만 (손패는 장수만)
    @Getter
    @Builder
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class PlayerView {
        private String memberId;
        private String name;
        private int score;
        private int handCount;
        private List<LandView> landsInPlay;
        private List<GiftView> gifts;
        private String building;
    }

    @Getter
    @Builder
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class LandView {
        private String color;
        private boolean tapped;
    }

    @Getter
    @Builder
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class GiftView {
        private String giftId;
        private String color;
        private String giftClass;
        private int locks;
        private String ownerId;
        private boolean sealed;
    }

    // 본인만 보는 정보
    @Getter
    @Builder
    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public static class ViewerView {
        private String memberId;
        private String name;
        private List<String> hand;
        private List<LandView> landsInPlay;
        private String building;
        private int pendingDiscard;
    }
}
