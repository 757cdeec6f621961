package com.copyleft.GiftsUnderSiege.feature.game;

import com.copyleft.GiftsUnderSiege.config.GameProperties;
import com.copyleft.GiftsUnderSiege.domain.GameSession;
import com.copyleft.GiftsUnderSiege.domain.Player;
import com.copyleft.GiftsUnderSiege.global.constant.ErrorCode;
import com.copyleft.GiftsUnderSiege.global.exception.GameRuleException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Objects;

@Slf4j
@Component
@RequiredArgsConstructor
public class TurnController {

    private final GameProperties gameProperties;

    /**
     * 모든 변경 액션 공통 검사: 게임 진행 중 + 요청자의 턴.
     */
    public void requireTurn(GameSession session, String requesterId) {
        if (!session.isActive()) {
            throw new GameRuleException(ErrorCode.GAME_ENDED);
        }
        if (!Objects.equals(session.getTurn().getPlayerId(), requesterId)) {
            throw new GameRuleException(ErrorCode.NOT_YOUR_TURN);
        }
    }

    /**
     * 메인 액션(획득/훔치기/포장/건설/재활용)은 턴당 한 번.
     */
    public void requireMainAction(GameSession session, String requesterId) {
        requireTurn(session, requesterId);
        if (session.getTurn().isActionTaken()) {
            throw new GameRuleException(ErrorCode.ACTION_ALREADY_TAKEN);
        }
    }

    public void markMainActionTaken(GameSession session) {
        session.getTurn().setActionTaken(true);
    }

    /**
     * 현재 턴 주인의 대지를 모두 풀고 한 장 뽑는다.
     */
    public void startTurn(GameSession session) {
        Player player = session.getCurrentPlayer();
        player.untapAll();
        session.getTurn().setLandPlayed(false);
        session.getTurn().setActionTaken(false);
        drawCards(session, player, 1);
    }

    public void endTurn(GameSession session, String requesterId) {
        requireTurn(session, requesterId);
        Player player = session.getCurrentPlayer();
        if (player.getPendingDiscard() > 0) {
            throw new GameRuleException(ErrorCode.DISCARD_REQUIRED);
        }

        trimHand(player);
        advance(session);
    }

    /**
     * 덱이 비어 있으면 게임을 종료 상태로 바꾸고 DECK_EMPTY 를 던진다.
     */
    public void drawCards(GameSession session, Player player, int count) {
        for (int i = 0; i < count; i++) {
            if (session.getDeck().isEmpty()) {
                session.end();
                log.info("덱 소진으로 게임 종료: gameId={}, player={}", session.getGameId(), player.getMemberId());
                throw new GameRuleException(ErrorCode.DECK_EMPTY);
            }
            player.getHand().add(session.getDeck().remove(0));
        }
    }

    // 손패 상한 초과분은 뒤에서부터 버린다
    private void trimHand(Player player) {
        List<?> hand = player.getHand();
        int limit = gameProperties.handLimit();
        while (hand.size() > limit) {
            hand.remove(hand.size() - 1);
        }
    }

    private void advance(GameSession session) {
        List<Player> players = session.getPlayers();
        int currentIndex = session.indexOfPlayer(session.getTurn().getPlayerId());
        Player next = players.get((currentIndex + 1) % players.size());

        session.getTurn().passTo(next.getMemberId());
        startTurn(session);
    }
}
