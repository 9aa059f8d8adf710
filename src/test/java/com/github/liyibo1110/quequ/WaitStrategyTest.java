package com.github.liyibo1110.quequ;

import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * {@link WaitStrategy}的单元测试
 * @author liyibo
 * @date 2026-02-09 09:30
 */
class WaitStrategyTest {

    @Test
    void singletons() {
        assertSame(YieldingWait.INSTANCE, WaitStrategy.yielding());
        assertSame(SpinningWait.INSTANCE, WaitStrategy.spinning());
        assertSame(BackoffWait.INSTANCE, WaitStrategy.backingOff());
    }

    @Test
    void backoffEscalatesWithoutBlocking() {
        long start = System.nanoTime();
        for(int attempt = 0; attempt < 100; attempt++)
            WaitStrategy.backingOff().idle(attempt);
        assertTrue(System.nanoTime() - start < TimeUnit.SECONDS.toNanos(5));
    }

    @Test
    void customStrategySeesAttempts() {
        int[] lastAttempt = {-1};
        RingQueue<Integer> queue = Quequ.newBuilder()
                .capacity(8)
                .waitStrategy(attempt -> lastAttempt[0] = attempt)
                .build();
        assertFalse(queue.get().ok());
        assertEquals(0, lastAttempt[0]);
    }
}
