package com.copyleft.GiftsUnderSiege.feature.game;

import com.copyleft.GiftsUnderSiege.config.GameProperties;
import com.copyleft.GiftsUnderSiege.domain.GameSession;
import com.copyleft.GiftsUnderSiege.domain.Gift;
import com.copyleft.GiftsUnderSiege.domain.type.GameStatus;
import com.copyleft.GiftsUnderSiege.feature.game.dto.GameRequests;
import com.copyleft.GiftsUnderSiege.global.constant.ErrorCode;
import com.copyleft.GiftsUnderSiege.global.exception.GameRuleException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GameSetupFactoryTest {

    private GameSetupFactory factory;

    @BeforeEach
    void setUp() {
        GameProperties properties = GameFixtures.properties();
        factory = new GameSetupFactory(properties, new TurnController(properties));
    }

    @Test
    @DisplayName("게임 준비: 시작 손패 5장, 첫 플레이어는 한 장 더, 선물 8개 전시")
    void create_Success() {
        // given
        List<GameRequests.PlayerEntry> entries = List.of(
                new GameRequests.PlayerEntry("s1", "하나"),
                new GameRequests.PlayerEntry("s2", "둘"));

        // when
        GameSession session = factory.create("game-1", "room-1", entries);

        // then
        assertEquals(GameStatus.ACTIVE, session.getStatus());
        assertEquals(2, session.getPlayers().size());
        assertEquals(6, session.getPlayers().get(0).getHand().size());
        assertEquals(5, session.getPlayers().get(1).getHand().size());
        assertEquals(5 * 12 - 11, session.getDeck().size());
        assertEquals(8, session.getGiftsDisplay().size());

        assertEquals("s1", session.getTurn().getPlayerId());
        assertEquals(1, session.getTurn().getNumber());
        assertFalse(session.getTurn().isLandPlayed());
        assertFalse(session.getTurn().isActionTaken());

        for (Gift gift : session.getGiftsDisplay()) {
            assertNull(gift.getOwnerId());
            assertEquals(0, gift.getLocks());
            assertNotNull(gift.getGiftClass());
            assertNotNull(gift.getColor());
        }
    }

    @Test
    @DisplayName("플레이어가 없으면 NOT_ENOUGH_PLAYERS")
    void create_NoPlayers() {
        GameRuleException ex = assertThrows(GameRuleException.class,
                () -> factory.create("game-1", "room-1", List.of()));

        assertEquals(ErrorCode.NOT_ENOUGH_PLAYERS, ex.getErrorCode());
    }

    @Test
    @DisplayName("같은 memberId 가 두 번 들어오면 INVALID_PAYLOAD")
    void create_DuplicateMember() {
        List<GameRequests.PlayerEntry> entries = List.of(
                new GameRequests.PlayerEntry("s1", "하나"),
                new GameRequests.PlayerEntry("s1", "또하나"));

        GameRuleException ex = assertThrows(GameRuleException.class,
                () -> factory.create("game-1", "room-1", entries));

        assertEquals(ErrorCode.INVALID_PAYLOAD, ex.getErrorCode());
    }
}
