package com.github.liyibo1110.quequ;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.LockSupport;

/**
 * 让出执行机会的方式，用在准入失败、CAS失败以及槽位自旋这3个地方
 * 都只是调度提示而不是阻塞等待（默认有3种实现）
 * @author liyibo
 * @date 2026-02-04 09:15
 */
@FunctionalInterface
public interface WaitStrategy {

    /**
     * @param attempt 当前调用里已经连续失败的次数，从0开始
     */
    void idle(int attempt);

    /**
     * 获取YieldingWait单例，默认值
     */
    static WaitStrategy yielding() {
        return YieldingWait.INSTANCE;
    }

    /**
     * 获取SpinningWait单例
     */
    static WaitStrategy spinning() {
        return SpinningWait.INSTANCE;
    }

    /**
     * 获取BackoffWait单例
     */
    static WaitStrategy backingOff() {
        return BackoffWait.INSTANCE;
    }
}

/**
 * 交出剩余的时间片
 */
enum YieldingWait implements WaitStrategy {
    INSTANCE;

    @Override
    public void idle(int attempt) {
        Thread.yield();
    }
}

/**
 * 纯自旋，只给CPU一个提示
 */
enum SpinningWait implements WaitStrategy {
    INSTANCE;

    @Override
    public void idle(int attempt) {
        Thread.onSpinWait();
    }
}

/**
 * 先自旋，再yield，最后短暂park
 */
enum BackoffWait implements WaitStrategy {
    INSTANCE;

    static final int SPIN_ATTEMPTS = 32;
    static final int YIELD_ATTEMPTS = 64;
    static final long PARK_NANOS = TimeUnit.MICROSECONDS.toNanos(1);

    @Override
    public void idle(int attempt) {
        if(attempt < SPIN_ATTEMPTS)
            Thread.onSpinWait();
        else if(attempt < YIELD_ATTEMPTS)
            Thread.yield();
        else
            LockSupport.parkNanos(PARK_NANOS);
    }
}
