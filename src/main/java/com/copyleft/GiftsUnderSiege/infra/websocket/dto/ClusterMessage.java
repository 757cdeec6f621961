package com.copyleft.GiftsUnderSiege.infra.websocket.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

// 다른 서버에 연결된 세션으로 보낼 메시지
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class ClusterMessage {
    private String sessionId;
    private String content;
}
