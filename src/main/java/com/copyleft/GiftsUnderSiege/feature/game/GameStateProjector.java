package com.copyleft.GiftsUnderSiege.feature.game;

import com.copyleft.GiftsUnderSiege.domain.GameSession;
import com.copyleft.GiftsUnderSiege.domain.Gift;
import com.copyleft.GiftsUnderSiege.domain.LandInPlay;
import com.copyleft.GiftsUnderSiege.domain.Player;
import com.copyleft.GiftsUnderSiege.domain.TurnState;
import com.copyleft.GiftsUnderSiege.domain.type.BuildingType;
import com.copyleft.GiftsUnderSiege.domain.type.LandColor;
import com.copyleft.GiftsUnderSiege.feature.game.dto.GamePayloads;
import com.copyleft.GiftsUnderSiege.global.constant.ErrorCode;
import com.copyleft.GiftsUnderSiege.global.exception.GameRuleException;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;

/**
 * 보는 사람 기준의 읽기 전용 스냅샷을 만든다.
 * 다른 플레이어의 손패는 장수만 공개한다. 매 요청마다 새로 만든다.
 */
@Component
public class GameStateProjector {

    public GamePayloads.GameStateView project(GameSession session, String viewerId) {
        Player viewer = session.findPlayer(viewerId)
                .orElseThrow(() -> new GameRuleException(ErrorCode.PLAYER_NOT_FOUND));

        return GamePayloads.GameStateView.builder()
                .gameId(session.getGameId())
                .roomId(session.getRoomId())
                .status(session.getStatus().getCode())
                .createdAt(Instant.ofEpochMilli(session.getCreatedAt()).toString())
                .turn(toTurnView(session.getTurn()))
                .players(session.getPlayers().stream().map(this::toPlayerView).toList())
                .giftsDisplay(toGiftViews(session.getGiftsDisplay()))
                .viewer(toViewerView(viewer))
                .deckCount(session.getDeck().size())
                .build();
    }

    private GamePayloads.TurnView toTurnView(TurnState turn) {
        return GamePayloads.TurnView.builder()
                .playerId(turn.getPlayerId())
                .number(turn.getNumber())
                .hasPlayedLand(turn.isLandPlayed())
                .hasTakenAction(turn.isActionTaken())
                .build();
    }

    private GamePayloads.PlayerView toPlayerView(Player player) {
        return GamePayloads.PlayerView.builder()
                .memberId(player.getMemberId())
                .name(player.getName())
                .score(player.getScore())
                .handCount(player.getHand().size())
                .landsInPlay(toLandViews(player.getLandsInPlay()))
                .gifts(toGiftViews(player.getGifts()))
                .building(buildingCode(player.getBuilding()))
                .build();
    }

    private GamePayloads.ViewerView toViewerView(Player viewer) {
        return GamePayloads.ViewerView.builder()
                .memberId(viewer.getMemberId())
                .name(viewer.getName())
                .hand(viewer.getHand().stream().map(LandColor::getCode).toList())
                .landsInPlay(toLandViews(viewer.getLandsInPlay()))
                .building(buildingCode(viewer.getBuilding()))
                .pendingDiscard(viewer.getPendingDiscard())
                .build();
    }

    private List<GamePayloads.LandView> toLandViews(List<LandInPlay> lands) {
        return lands.stream()
                .map(land -> GamePayloads.LandView.builder()
                        .color(land.getColor().getCode())
                        .tapped(land.isTapped())
                        .build())
                .toList();
    }

    private List<GamePayloads.GiftView> toGiftViews(List<Gift> gifts) {
        return gifts.stream()
                .map(gift -> GamePayloads.GiftView.builder()
                        .giftId(gift.getGiftId())
                        .color(gift.getColor().getCode())
                        .giftClass(gift.getGiftClass().getCode())
                        .locks(gift.getLocks())
                        .ownerId(gift.getOwnerId())
                        .sealed(gift.isSealed())
                        .build())
                .toList();
    }

    private String buildingCode(BuildingType building) {
        return building != null ? building.getCode() : null;
    }
}
