package com.github.liyibo1110.quequ.stats;

import com.github.liyibo1110.quequ.Outcome;
import org.checkerframework.checker.index.qual.NonNegative;
import org.checkerframework.checker.nullness.qual.NonNull;

/**
 * 队列运行期间累积统计数据，供RingQueue.stats方法来呈现
 * 会在put和get的热路径上被调用，实现类必须是线程安全并且足够轻量的
 * @author liyibo
 * @date 2026-02-06 13:40
 */
public interface StatsCounter {

    /**
     * 每次put尝试结束时被调用
     */
    void recordPut(@NonNull Outcome outcome);

    /**
     * 每次get尝试结束时被调用
     */
    void recordGet(@NonNull Outcome outcome);

    /**
     * 预定了槽位之后，等待槽位就绪所自旋的次数，只在spins大于0时调用
     */
    void recordSlotSpins(@NonNegative int spins);

    /**
     * 卡住的生产者强制丢弃了1个元素
     */
    void recordStarvationEviction();

    /**
     * 卡住的消费者强制放入了1个占位元素
     */
    void recordStarvationInjection();

    /**
     * 返回当前计数器快照实例
     */
    @NonNull
    QueueStats snapshot();

    /**
     * 返回DisabledStatsCounter计数器的实例
     */
    static @NonNull StatsCounter disabledStatsCounter() {
        return DisabledStatsCounter.INSTANCE;
    }

    /**
     * 返回GuardedStatsCounter计数器的实例
     */
    static @NonNull StatsCounter guardedStatsCounter(@NonNull StatsCounter statsCounter) {
        return (statsCounter instanceof GuardedStatsCounter)
                ? statsCounter
                : new GuardedStatsCounter(statsCounter);
    }
}
