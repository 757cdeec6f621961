package com.copyleft.GiftsUnderSiege.global.exception;

import com.copyleft.GiftsUnderSiege.global.constant.ErrorCode;
import lombok.Getter;

/**
 * 게임 규칙 위반. 요청자에게만 전달되고 게임은 계속 진행된다.
 * DECK_EMPTY 만 예외적으로 게임을 종료시킨다.
 */
@Getter
public class GameRuleException extends RuntimeException {

    private final ErrorCode errorCode;

    public GameRuleException(ErrorCode errorCode) {
        super(errorCode.getMessage());
        this.errorCode = errorCode;
    }

    public GameRuleException(ErrorCode errorCode, String detail) {
        super(errorCode.getMessage() + " (" + detail + ")");
        this.errorCode = errorCode;
    }

    public boolean isTerminal() {
        return errorCode == ErrorCode.DECK_EMPTY;
    }
}
