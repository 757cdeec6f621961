package com.copyleft.GiftsUnderSiege.infra.websocket;

import com.copyleft.GiftsUnderSiege.infra.websocket.dto.ClusterMessage;
import com.copyleft.GiftsUnderSiege.infra.websocket.dto.WebSocketResponse;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.Spy;
import org.mockito.junit.jupiter.MockitoExtension;
import org.redisson.api.RTopic;
import org.redisson.api.RedissonClient;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class WebSocketSenderTest {

    @InjectMocks
    private WebSocketSender webSocketSender;

    @Mock private WebSocketSessionManager sessionManager;
    @Spy private ObjectMapper objectMapper = new ObjectMapper();
    @Mock private RedissonClient redissonClient;

    @Mock private WebSocketSession session;

    private final WebSocketResponse<Void> event = WebSocketResponse.<Void>builder()
            .event("GAME_ERROR")
            .code("NOT_YOUR_TURN")
            .build();

    @Test
    @DisplayName("로컬 세션이면 직접 전송한다")
    void sendEventToSession_Local() throws Exception {
        // given
        when(sessionManager.getSession("s1")).thenReturn(session);
        when(session.isOpen()).thenReturn(true);

        // when
        webSocketSender.sendEventToSession("s1", event);

        // then
        ArgumentCaptor<TextMessage> captor = ArgumentCaptor.forClass(TextMessage.class);
        verify(session).sendMessage(captor.capture());
        assertTrue(captor.getValue().getPayload().contains("\"code\":\"NOT_YOUR_TURN\""));
        assertFalse(captor.getValue().getPayload().contains("data"), "null 필드는 직렬화하지 않는다");
        verifyNoInteractions(redissonClient);
    }

    @Test
    @DisplayName("전송에 실패한 연결만 정리하고 예외는 밖으로 나가지 않는다")
    void sendEventToSession_Failure_EvictsOnlyThatSession() throws Exception {
        when(sessionManager.getSession("s1")).thenReturn(session);
        when(session.isOpen()).thenReturn(true);
        doThrow(new IOException("broken pipe")).when(session).sendMessage(any());

        assertDoesNotThrow(() -> webSocketSender.sendEventToSession("s1", event));

        verify(sessionManager).evict("s1");
    }

    @Test
    @DisplayName("다른 서버의 세션이면 클러스터 토픽으로 보낸다")
    void sendEventToSession_Remote() {
        RTopic topic = mock(RTopic.class);
        when(sessionManager.getSession("remote")).thenReturn(null);
        when(redissonClient.getTopic("ws-cluster-topic")).thenReturn(topic);

        webSocketSender.sendEventToSession("remote", event);

        ArgumentCaptor<ClusterMessage> captor = ArgumentCaptor.forClass(ClusterMessage.class);
        verify(topic).publish(captor.capture());
        assertEquals("remote", captor.getValue().getSessionId());
    }
}
