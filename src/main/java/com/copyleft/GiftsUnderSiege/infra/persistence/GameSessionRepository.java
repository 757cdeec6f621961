package com.copyleft.GiftsUnderSiege.infra.persistence;

import com.copyleft.GiftsUnderSiege.domain.GameSession;
import com.copyleft.GiftsUnderSiege.global.constant.RedisKey;
import lombok.RequiredArgsConstructor;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * 진행 중인 게임 상태 저장소.
 * 조회할 때마다 역직렬화된 새 사본을 돌려준다.
 */
@Repository
@RequiredArgsConstructor
public class GameSessionRepository {

    private static final long TTL_HOURS = 1L;

    private final RedisTemplate<String, GameSession> gameSessionRedisTemplate;
    private final StringRedisTemplate stringRedisTemplate;

    public void saveSession(GameSession session) {
        String key = RedisKey.GAME.makeKey(session.getGameId());

        gameSessionRedisTemplate.opsForValue().set(key, session, TTL_HOURS, TimeUnit.HOURS);
    }

    public Optional<GameSession> findSessionById(String gameId) {
        return Optional.ofNullable(gameSessionRedisTemplate.opsForValue().get(RedisKey.GAME.makeKey(gameId)));
    }

    public void deleteSession(String gameId) {
        gameSessionRedisTemplate.delete(RedisKey.GAME.makeKey(gameId));
    }

    public void saveRoomGameMapping(String roomId, String gameId) {
        stringRedisTemplate.opsForValue().set(RedisKey.ROOM_GAME.makeKey(roomId), gameId, TTL_HOURS, TimeUnit.HOURS);
    }

    public String findGameIdByRoomId(String roomId) {
        return stringRedisTemplate.opsForValue().get(RedisKey.ROOM_GAME.makeKey(roomId));
    }

    public void deleteRoomGameMapping(String roomId) {
        stringRedisTemplate.delete(RedisKey.ROOM_GAME.makeKey(roomId));
    }
}
