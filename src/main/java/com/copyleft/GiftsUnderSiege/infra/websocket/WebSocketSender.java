package com.copyleft.GiftsUnderSiege.infra.websocket;

import com.copyleft.GiftsUnderSiege.infra.websocket.dto.ClusterMessage;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.redisson.api.RTopic;
import org.redisson.api.RedissonClient;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.SessionLimitExceededException;

import java.io.IOException;

@Slf4j
@Component
@RequiredArgsConstructor
public class WebSocketSender {

    private final WebSocketSessionManager sessionManager;
    private final ObjectMapper objectMapper;
    private final RedissonClient redissonClient;

    private static final String TOPIC_NAME = "ws-cluster-topic";

    @PostConstruct
    public void init() {
        RTopic topic = redissonClient.getTopic(TOPIC_NAME);

        topic.addListener(ClusterMessage.class, (channel, msg) -> {
            try {
                if (sessionManager.getSession(msg.getSessionId()) != null) {
                    sendLocal(msg.getSessionId(), msg.getContent());
                }
            } catch (Exception e) {
                log.error("Cluster 메시지 처리 중 오류", e);
            }
        });
        log.info("Redis Pub/Sub 구독 시작: Topic={}", TOPIC_NAME);
    }

    public void sendEventToSession(String sessionId, Object event) {
        String payload;
        try {
            payload = objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            log.error("메시지 변환 실패: session={}", sessionId, e);
            return;
        }

        if (sessionManager.getSession(sessionId) != null) {
            sendLocal(sessionId, payload);
        } else {
            publishToCluster(sessionId, payload);
        }
    }

    private void sendLocal(String sessionId, String payload) {
        WebSocketSession session = sessionManager.getSession(sessionId);
        if (session == null || !session.isOpen()) {
            log.warn("세션을 찾을 수 없거나 닫혀있습니다: [세션 ID: {}]", sessionId);
            return;
        }
        try {
            session.sendMessage(new TextMessage(payload));
            log.debug("전송 성공 (Local): {}", sessionId);
        } catch (IOException | SessionLimitExceededException e) {
            // 한 명의 전송 실패는 그 연결만 끊는다
            log.error("전송 실패 (Local): {}", sessionId, e);
            sessionManager.evict(sessionId);
        }
    }

    private void publishToCluster(String sessionId, String payload) {
        RTopic topic = redissonClient.getTopic(TOPIC_NAME);
        topic.publish(new ClusterMessage(sessionId, payload));
    }
}
