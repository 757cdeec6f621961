package com.copyleft.GiftsUnderSiege.feature.game;

import com.copyleft.GiftsUnderSiege.global.constant.ErrorCode;
import com.copyleft.GiftsUnderSiege.global.constant.RedisKey;
import com.copyleft.GiftsUnderSiege.global.exception.GameRuleException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.redisson.api.RLock;
import org.redisson.api.RedissonClient;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class GameLockFacadeTest {

    @InjectMocks
    private GameLockFacade lockFacade;

    @Mock private RedissonClient redissonClient;
    @Mock private RLock lock;

    @BeforeEach
    void setUp() {
        when(redissonClient.getLock(RedisKey.GAME_LOCK.makeKey("game-1"))).thenReturn(lock);
    }

    @Test
    @DisplayName("락을 잡으면 작업을 실행하고 락을 푼다")
    void execute_Success() throws Exception {
        // given
        when(lock.tryLock(2L, 5L, TimeUnit.SECONDS)).thenReturn(true);
        when(lock.isHeldByCurrentThread()).thenReturn(true);

        // when
        LockResult<String> result = lockFacade.execute("game-1", () -> "done");

        // then
        assertTrue(result.isSuccess());
        assertEquals("done", result.getData());
        verify(lock).unlock();
    }

    @Test
    @DisplayName("결과가 없는 작업은 BUSINESS_SKIPPED")
    void execute_Runnable_Skipped() throws Exception {
        when(lock.tryLock(2L, 5L, TimeUnit.SECONDS)).thenReturn(true);
        when(lock.isHeldByCurrentThread()).thenReturn(true);
        AtomicBoolean ran = new AtomicBoolean(false);

        LockResult<Void> result = lockFacade.execute("game-1", () -> ran.set(true));

        assertTrue(ran.get());
        assertTrue(result.isSkipped());
    }

    @Test
    @DisplayName("룰 위반은 그대로 던지고 락은 풀린다")
    void execute_RuleViolation_Propagates() throws Exception {
        when(lock.tryLock(2L, 5L, TimeUnit.SECONDS)).thenReturn(true);
        when(lock.isHeldByCurrentThread()).thenReturn(true);

        Runnable action = () -> {
            throw new GameRuleException(ErrorCode.NOT_YOUR_TURN);
        };

        GameRuleException ex = assertThrows(GameRuleException.class,
                () -> lockFacade.execute("game-1", action));

        assertEquals(ErrorCode.NOT_YOUR_TURN, ex.getErrorCode());
        verify(lock).unlock();
    }

    @Test
    @DisplayName("재시도 후에도 락을 못 잡으면 LOCK_FAILED, 작업은 실행되지 않는다")
    void execute_LockFailed() throws Exception {
        when(lock.tryLock(2L, 5L, TimeUnit.SECONDS)).thenReturn(false);
        AtomicBoolean ran = new AtomicBoolean(false);

        LockResult<Void> result = lockFacade.execute("game-1", () -> ran.set(true));

        assertTrue(result.isLockFailed());
        assertFalse(ran.get());
        verify(lock, times(3)).tryLock(2L, 5L, TimeUnit.SECONDS);
        verify(lock, never()).unlock();
    }
}
