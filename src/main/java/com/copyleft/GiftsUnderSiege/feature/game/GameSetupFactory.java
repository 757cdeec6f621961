package com.copyleft.GiftsUnderSiege.feature.game;

import com.copyleft.GiftsUnderSiege.config.GameProperties;
import com.copyleft.GiftsUnderSiege.domain.GameSession;
import com.copyleft.GiftsUnderSiege.domain.Gift;
import com.copyleft.GiftsUnderSiege.domain.Player;
import com.copyleft.GiftsUnderSiege.domain.TurnState;
import com.copyleft.GiftsUnderSiege.domain.type.GiftClass;
import com.copyleft.GiftsUnderSiege.domain.type.LandColor;
import com.copyleft.GiftsUnderSiege.feature.game.dto.GameRequests;
import com.copyleft.GiftsUnderSiege.global.constant.ErrorCode;
import com.copyleft.GiftsUnderSiege.global.exception.GameRuleException;
import com.copyleft.GiftsUnderSiege.global.util.RandomUtil;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

@Component
@RequiredArgsConstructor
public class GameSetupFactory {

    private final GameProperties gameProperties;
    private final TurnController turnController;

    /**
     * 새 게임을 준비한다: 덱 셔플, 선물 전시, 시작 손패 분배, 첫 턴 시작.
     */
    public GameSession create(String gameId, String roomId, List<GameRequests.PlayerEntry> entries) {
        List<Player> players = toPlayers(entries);

        GameSession session = GameSession.builder()
                .gameId(gameId)
                .roomId(roomId)
                .players(players)
                .deck(buildDeck())
                .giftsDisplay(buildGiftDisplay())
                .build();

        for (Player player : players) {
            turnController.drawCards(session, player, gameProperties.initialHand());
        }
        session.setTurn(TurnState.first(players.get(0).getMemberId()));
        turnController.startTurn(session);
        return session;
    }

    private List<Player> toPlayers(List<GameRequests.PlayerEntry> entries) {
        if (entries == null || entries.size() < Math.max(1, gameProperties.minPlayerCount())) {
            throw new GameRuleException(ErrorCode.NOT_ENOUGH_PLAYERS);
        }

        Set<String> seen = new HashSet<>();
        List<Player> players = new ArrayList<>(entries.size());
        for (GameRequests.PlayerEntry entry : entries) {
            if (entry == null || !StringUtils.hasText(entry.getMemberId()) || !seen.add(entry.getMemberId())) {
                throw new GameRuleException(ErrorCode.INVALID_PAYLOAD, "players");
            }
            players.add(Player.join(entry.getMemberId(), entry.getName()));
        }
        return players;
    }

    private List<LandColor> buildDeck() {
        List<LandColor> deck = new ArrayList<>();
        for (LandColor color : LandColor.values()) {
            for (int i = 0; i < gameProperties.deckSizePerColor(); i++) {
                deck.add(color);
            }
        }
        RandomUtil.shuffle(deck);
        return deck;
    }

    private List<Gift> buildGiftDisplay() {
        GiftClass[] classes = GiftClass.values();
        int[] weights = new int[classes.length];
        for (int i = 0; i < classes.length; i++) {
            weights[i] = classes[i].getWeight();
        }

        List<Gift> pool = new ArrayList<>(gameProperties.giftPoolSize());
        for (int i = 0; i < gameProperties.giftPoolSize(); i++) {
            pool.add(Gift.builder()
                    .giftId(RandomUtil.generateId())
                    .color(RandomUtil.pickOne(LandColor.values()))
                    .giftClass(classes[RandomUtil.pickWeightedIndex(weights)])
                    .build());
        }

        int displayCount = Math.min(gameProperties.giftsInDisplay(), pool.size());
        return new ArrayList<>(pool.subList(0, displayCount));
    }
}
