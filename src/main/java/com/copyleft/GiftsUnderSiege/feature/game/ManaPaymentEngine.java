package com.copyleft.GiftsUnderSiege.feature.game;

import com.copyleft.GiftsUnderSiege.domain.LandInPlay;
import com.copyleft.GiftsUnderSiege.domain.Player;
import com.copyleft.GiftsUnderSiege.domain.vo.ManaCost;
import com.copyleft.GiftsUnderSiege.global.constant.ErrorCode;
import com.copyleft.GiftsUnderSiege.global.exception.GameRuleException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * 전장의 대지를 탭해서 비용을 지불한다.
 * 대지는 낸 순서대로 고르며, 모든 검사가 통과한 뒤에만 탭한다.
 */
@Component
public class ManaPaymentEngine {

    /**
     * 비용을 지불할 대지를 고른다. 아무것도 탭하지 않는다.
     *
     * @throws GameRuleException INSUFFICIENT_MANA, INSUFFICIENT_COLOR
     */
    public List<LandInPlay> select(Player player, ManaCost cost) {
        List<LandInPlay> untapped = player.getLandsInPlay().stream()
                .filter(land -> !land.isTapped())
                .toList();

        if (untapped.size() < cost.total()) {
            throw new GameRuleException(ErrorCode.INSUFFICIENT_MANA);
        }

        List<LandInPlay> chosen = new ArrayList<>(cost.total());
        if (cost.requiresColor()) {
            List<LandInPlay> colorMatches = untapped.stream()
                    .filter(land -> land.getColor() == cost.color())
                    .limit(cost.colorAmount())
                    .toList();
            if (colorMatches.size() < cost.colorAmount()) {
                throw new GameRuleException(ErrorCode.INSUFFICIENT_COLOR);
            }
            chosen.addAll(colorMatches);
        }

        for (LandInPlay land : untapped) {
            if (chosen.size() >= cost.total()) {
                break;
            }
            if (!chosen.contains(land)) {
                chosen.add(land);
            }
        }
        return chosen;
    }

    public void tap(List<LandInPlay> lands) {
        for (LandInPlay land : lands) {
            land.setTapped(true);
        }
    }

    /**
     * 선택과 탭을 한 번에 수행한다. 실패하면 아무 대지도 탭되지 않는다.
     */
    public void pay(Player player, ManaCost cost) {
        tap(select(player, cost));
    }
}
