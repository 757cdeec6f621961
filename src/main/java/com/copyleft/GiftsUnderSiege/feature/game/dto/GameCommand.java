package com.copyleft.GiftsUnderSiege.feature.game.dto;

import com.copyleft.GiftsUnderSiege.domain.type.BuildingType;

import java.util.List;

/**
 * 검증을 마친 플레이어 액션. 액션 종류마다 하나의 레코드.
 */
public sealed interface GameCommand {

    GameActionType type();

    record PlayLand(int index) implements GameCommand {
        public GameActionType type() { return GameActionType.PLAY_LAND; }
    }

    record ClaimGift(String giftId) implements GameCommand {
        public GameActionType type() { return GameActionType.CLAIM_GIFT; }
    }

    /**
     * discardIndices 가 null 이면 손패 앞에서부터 버린다.
     */
    record StealGift(String giftId, boolean addLock, List<Integer> discardIndices) implements GameCommand {
        public GameActionType type() { return GameActionType.STEAL_GIFT; }
    }

    record WrapGift(String giftId) implements GameCommand {
        public GameActionType type() { return GameActionType.WRAP_GIFT; }
    }

    record BuildBuilding(BuildingType building) implements GameCommand {
        public GameActionType type() { return GameActionType.BUILD_BUILDING; }
    }

    record Recycle() implements GameCommand {
        public GameActionType type() { return GameActionType.RECYCLE; }
    }

    record Discard(int index) implements GameCommand {
        public GameActionType type() { return GameActionType.DISCARD; }
    }

    record EndTurn() implements GameCommand {
        public GameActionType type() { return GameActionType.END_TURN; }
    }
}
