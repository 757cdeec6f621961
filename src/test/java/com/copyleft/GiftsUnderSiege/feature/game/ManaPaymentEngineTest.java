package com.copyleft.GiftsUnderSiege.feature.game;

import com.copyleft.GiftsUnderSiege.domain.LandInPlay;
import com.copyleft.GiftsUnderSiege.domain.Player;
import com.copyleft.GiftsUnderSiege.domain.type.LandColor;
import com.copyleft.GiftsUnderSiege.domain.vo.ManaCost;
import com.copyleft.GiftsUnderSiege.global.constant.ErrorCode;
import com.copyleft.GiftsUnderSiege.global.exception.GameRuleException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ManaPaymentEngineTest {

    private ManaPaymentEngine engine;
    private Player player;

    @BeforeEach
    void setUp() {
        engine = new ManaPaymentEngine();
        player = Player.join("p1", "하나");
    }

    @Test
    @DisplayName("색상 대지를 먼저 고르고 나머지는 낸 순서대로 채운다")
    void select_ColorFirstThenInOrder() {
        // given: G, R, R, G
        GameFixtures.addLands(player, LandColor.GREEN, 1);
        GameFixtures.addLands(player, LandColor.RED, 2);
        GameFixtures.addLands(player, LandColor.GREEN, 1);
        List<LandInPlay> lands = player.getLandsInPlay();

        // when
        List<LandInPlay> chosen = engine.select(player, ManaCost.ofColor(3, 2, LandColor.RED));

        // then
        assertEquals(3, chosen.size());
        assertSame(lands.get(1), chosen.get(0));
        assertSame(lands.get(2), chosen.get(1));
        assertSame(lands.get(0), chosen.get(2));
        assertEquals(0, player.getTappedLandCount(), "select 는 탭하지 않는다");
    }

    @Test
    @DisplayName("지불에 성공하면 정확히 total 장이 탭된다")
    void pay_TapsExactlyTotal() {
        GameFixtures.addLands(player, LandColor.BLUE, 4);

        engine.pay(player, ManaCost.WRAP);

        assertEquals(2, player.getTappedLandCount());
        assertTrue(player.getLandsInPlay().get(0).isTapped());
        assertTrue(player.getLandsInPlay().get(1).isTapped());
        assertFalse(player.getLandsInPlay().get(2).isTapped());
    }

    @Test
    @DisplayName("탭된 대지는 지불에 쓰이지 않는다")
    void select_SkipsTappedLands() {
        GameFixtures.addLands(player, LandColor.RED, 3);
        player.getLandsInPlay().get(0).setTapped(true);

        GameRuleException ex = assertThrows(GameRuleException.class,
                () -> engine.pay(player, ManaCost.of(3)));

        assertEquals(ErrorCode.INSUFFICIENT_MANA, ex.getErrorCode());
        assertEquals(1, player.getTappedLandCount());
    }

    @Test
    @DisplayName("총량은 충분하지만 색상이 부족하면 INSUFFICIENT_COLOR, 아무것도 탭되지 않는다")
    void pay_InsufficientColor_NoTap() {
        GameFixtures.addLands(player, LandColor.RED, 1);
        GameFixtures.addLands(player, LandColor.WHITE, 4);

        GameRuleException ex = assertThrows(GameRuleException.class,
                () -> engine.pay(player, ManaCost.ofColor(3, 2, LandColor.RED)));

        assertEquals(ErrorCode.INSUFFICIENT_COLOR, ex.getErrorCode());
        assertEquals(0, player.getTappedLandCount());
    }

    @Test
    @DisplayName("총량 검사가 색상 검사보다 먼저다")
    void select_TotalCheckedBeforeColor() {
        GameFixtures.addLands(player, LandColor.WHITE, 2);

        GameRuleException ex = assertThrows(GameRuleException.class,
                () -> engine.select(player, ManaCost.ofColor(3, 2, LandColor.RED)));

        assertEquals(ErrorCode.INSUFFICIENT_MANA, ex.getErrorCode());
    }

    @Test
    @DisplayName("비용 0 은 아무것도 고르지 않는다")
    void select_ZeroCost() {
        assertTrue(engine.select(player, ManaCost.of(0)).isEmpty());
    }
}
