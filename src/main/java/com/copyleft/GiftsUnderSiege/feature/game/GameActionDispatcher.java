package com.copyleft.GiftsUnderSiege.feature.game;

import com.copyleft.GiftsUnderSiege.config.GameProperties;
import com.copyleft.GiftsUnderSiege.domain.GameSession;
import com.copyleft.GiftsUnderSiege.domain.Gift;
import com.copyleft.GiftsUnderSiege.domain.LandInPlay;
import com.copyleft.GiftsUnderSiege.domain.Player;
import com.copyleft.GiftsUnderSiege.domain.type.BuildingType;
import com.copyleft.GiftsUnderSiege.domain.type.LandColor;
import com.copyleft.GiftsUnderSiege.domain.vo.ManaCost;
import com.copyleft.GiftsUnderSiege.feature.game.dto.GameCommand;
import com.copyleft.GiftsUnderSiege.global.constant.ErrorCode;
import com.copyleft.GiftsUnderSiege.global.constant.GameCode;
import com.copyleft.GiftsUnderSiege.global.exception.GameRuleException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;

/**
 * 검증된 GameCommand 하나를 게임 상태에 적용한다.
 * 각 핸들러는 모든 검사를 먼저 끝내고 마지막에 상태를 바꾼다.
 * (덱 소진만 예외: 게임이 종료 상태로 바뀐 채 DECK_EMPTY 가 던져진다)
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GameActionDispatcher {

    private static final int THIEFS_GLOVES_DISCOUNT = 2;

    private final TurnController turnController;
    private final ManaPaymentEngine manaPaymentEngine;
    private final GameProperties gameProperties;

    public GameCode dispatch(GameSession session, String requesterId, GameCommand command) {
        GameCode result = switch (command.type()) {
            case PLAY_LAND -> playLand(session, requesterId, (GameCommand.PlayLand) command);
            case CLAIM_GIFT -> claimGift(session, requesterId, (GameCommand.ClaimGift) command);
            case STEAL_GIFT -> stealGift(session, requesterId, (GameCommand.StealGift) command);
            case WRAP_GIFT -> wrapGift(session, requesterId, (GameCommand.WrapGift) command);
            case BUILD_BUILDING -> buildBuilding(session, requesterId, (GameCommand.BuildBuilding) command);
            case RECYCLE -> recycle(session, requesterId);
            case DISCARD -> discard(session, requesterId, (GameCommand.Discard) command);
            case END_TURN -> endTurn(session, requesterId);
        };

        log.debug("액션 적용 완료: gameId={}, player={}, action={}, turn={}",
                session.getGameId(), requesterId, command.type(), session.getTurn().getNumber());
        return result;
    }

    private GameCode playLand(GameSession session, String requesterId, GameCommand.PlayLand command) {
        turnController.requireTurn(session, requesterId);
        Player player = session.getCurrentPlayer();

        if (session.getTurn().isLandPlayed()) {
            throw new GameRuleException(ErrorCode.LAND_ALREADY_PLAYED);
        }
        if (player.getLandsInPlay().size() >= gameProperties.landLimit()) {
            throw new GameRuleException(ErrorCode.LAND_LIMIT_REACHED);
        }
        if (!player.isValidHandIndex(command.index())) {
            throw new GameRuleException(ErrorCode.INVALID_HAND_INDEX);
        }

        LandColor color = player.getHand().remove(command.index());
        player.getLandsInPlay().add(LandInPlay.untapped(color));
        session.getTurn().setLandPlayed(true);
        return GameCode.LAND_PLAYED;
    }

    private GameCode claimGift(GameSession session, String requesterId, GameCommand.ClaimGift command) {
        turnController.requireMainAction(session, requesterId);
        Player player = session.getCurrentPlayer();

        Gift gift = session.findDisplayGift(command.giftId())
                .orElseThrow(() -> new GameRuleException(ErrorCode.GIFT_NOT_AVAILABLE));
        List<LandInPlay> payment = manaPaymentEngine.select(player, gift.getGiftClass().costFor(gift.getColor()));

        manaPaymentEngine.tap(payment);
        session.removeDisplayGift(gift.getGiftId());
        gift.setOwnerId(requesterId);
        gift.addLocks(1);
        player.getGifts().add(gift);
        turnController.markMainActionTaken(session);
        return GameCode.GIFT_CLAIMED;
    }

    private GameCode stealGift(GameSession session, String requesterId, GameCommand.StealGift command) {
        turnController.requireMainAction(session, requesterId);
        Player thief = session.getCurrentPlayer();

        Player owner = session.findGiftOwner(command.giftId())
                .orElseThrow(() -> new GameRuleException(ErrorCode.GIFT_NOT_FOUND));
        if (Objects.equals(owner.getMemberId(), requesterId)) {
            throw new GameRuleException(ErrorCode.CANNOT_STEAL_OWN_GIFT);
        }
        Gift gift = owner.findGift(command.giftId())
                .orElseThrow(() -> new GameRuleException(ErrorCode.GIFT_NOT_FOUND));
        if (gift.isSealed()) {
            throw new GameRuleException(ErrorCode.GIFT_SEALED);
        }

        // 자물쇠 수만큼 손패를 버려야 한다
        int discardCount = gift.getLocks();
        if (thief.hasBuilding(BuildingType.THIEFS_GLOVES)) {
            discardCount = Math.max(0, discardCount - THIEFS_GLOVES_DISCOUNT);
        }
        if (thief.getHand().size() < discardCount) {
            throw new GameRuleException(ErrorCode.INSUFFICIENT_HAND_FOR_DISCARD);
        }
        List<Integer> discardOrder = resolveDiscardOrder(thief, discardCount, command.discardIndices());
        List<LandInPlay> payment = manaPaymentEngine.select(thief, gift.getGiftClass().costFor(gift.getColor()));

        manaPaymentEngine.tap(payment);
        for (int index : discardOrder) {
            thief.getHand().remove(index);
        }
        owner.removeGift(gift.getGiftId());
        gift.setOwnerId(requesterId);
        if (command.addLock() && thief.hasBuilding(BuildingType.CROWBAR)) {
            gift.addLocks(1);
        }
        thief.getGifts().add(gift);
        turnController.markMainActionTaken(session);

        log.info("선물 도난: gameId={}, gift={}, from={}, to={}, discarded={}",
                session.getGameId(), gift.getGiftId(), owner.getMemberId(), requesterId, discardCount);
        return GameCode.GIFT_STOLEN;
    }

    /**
     * 버릴 손패 인덱스를 큰 것부터 정렬해서 돌려준다 (앞쪽 인덱스가 밀리지 않도록).
     */
    private List<Integer> resolveDiscardOrder(Player player, int discardCount, List<Integer> requested) {
        List<Integer> order = new ArrayList<>(discardCount);
        if (requested == null) {
            for (int i = discardCount - 1; i >= 0; i--) {
                order.add(i);
            }
            return order;
        }

        if (requested.size() != discardCount || new HashSet<>(requested).size() != requested.size()) {
            throw new GameRuleException(ErrorCode.INVALID_DISCARD_SELECTION);
        }
        for (int index : requested) {
            if (!player.isValidHandIndex(index)) {
                throw new GameRuleException(ErrorCode.INVALID_DISCARD_SELECTION);
            }
        }
        order.addAll(requested);
        order.sort(Comparator.reverseOrder());
        return order;
    }

    private GameCode wrapGift(GameSession session, String requesterId, GameCommand.WrapGift command) {
        turnController.requireMainAction(session, requesterId);
        Player player = session.getCurrentPlayer();

        Gift gift = player.findGift(command.giftId())
                .orElseThrow(() -> new GameRuleException(ErrorCode.NOT_YOUR_GIFT));
        manaPaymentEngine.pay(player, ManaCost.WRAP);

        gift.addLocks(player.hasBuilding(BuildingType.REINFORCED_RIBBON) ? 2 : 1);
        turnController.markMainActionTaken(session);
        return GameCode.GIFT_WRAPPED;
    }

    private GameCode buildBuilding(GameSession session, String requesterId, GameCommand.BuildBuilding command) {
        if (!session.isActive()) {
            throw new GameRuleException(ErrorCode.GAME_ENDED);
        }
        // 건물은 한 번뿐: 턴이나 액션 사용 여부와 상관없이 먼저 거절한다
        boolean alreadyBuilt = session.findPlayer(requesterId)
                .map(p -> p.getBuilding() != null)
                .orElse(false);
        if (alreadyBuilt) {
            throw new GameRuleException(ErrorCode.BUILDING_ALREADY_BUILT);
        }

        turnController.requireMainAction(session, requesterId);
        Player player = session.getCurrentPlayer();
        manaPaymentEngine.pay(player, command.building().cost());

        player.setBuilding(command.building());
        turnController.markMainActionTaken(session);
        return GameCode.BUILDING_BUILT;
    }

    private GameCode recycle(GameSession session, String requesterId) {
        turnController.requireMainAction(session, requesterId);
        Player player = session.getCurrentPlayer();

        if (player.getPendingDiscard() > 0) {
            throw new GameRuleException(ErrorCode.DISCARD_ALREADY_PENDING);
        }

        int drawCount = player.hasBuilding(BuildingType.SUPPLY_WAREHOUSE) ? 2 : 1;
        turnController.drawCards(session, player, drawCount);
        player.setPendingDiscard(1);
        turnController.markMainActionTaken(session);
        return GameCode.CARDS_RECYCLED;
    }

    private GameCode discard(GameSession session, String requesterId, GameCommand.Discard command) {
        turnController.requireTurn(session, requesterId);
        Player player = session.getCurrentPlayer();

        if (player.getPendingDiscard() <= 0) {
            throw new GameRuleException(ErrorCode.NO_DISCARD_PENDING);
        }
        if (!player.isValidHandIndex(command.index())) {
            throw new GameRuleException(ErrorCode.INVALID_HAND_INDEX);
        }

        player.getHand().remove(command.index());
        player.setPendingDiscard(player.getPendingDiscard() - 1);
        return GameCode.CARD_DISCARDED;
    }

    private GameCode endTurn(GameSession session, String requesterId) {
        turnController.endTurn(session, requesterId);
        return GameCode.TURN_ENDED;
    }
}
