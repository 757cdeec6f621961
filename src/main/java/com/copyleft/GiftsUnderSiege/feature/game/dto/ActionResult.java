package com.copyleft.GiftsUnderSiege.feature.game.dto;

import com.copyleft.GiftsUnderSiege.domain.GameSession;
import com.copyleft.GiftsUnderSiege.global.constant.GameCode;

// 락 안에서 저장까지 끝난 게임 상태의 사본
public record ActionResult(GameSession session, GameCode code) {}
