package com.github.liyibo1110.quequ.stats;

import com.github.liyibo1110.quequ.Outcome;
import org.checkerframework.checker.nullness.qual.NonNull;

import java.util.concurrent.atomic.LongAdder;

/**
 * 线程安全的StatsCounter实现，基于LongAdder，热路径上不会和游标争抢同一个缓存行
 * @author liyibo
 * @date 2026-02-06 13:52
 */
public class ConcurrentStatsCounter implements StatsCounter {
    private final LongAdder putSuccessCount;
    private final LongAdder putDeniedCount;
    private final LongAdder putLostCount;
    private final LongAdder getSuccessCount;
    private final LongAdder getDeniedCount;
    private final LongAdder getLostCount;
    private final LongAdder slotSpinCount;
    private final LongAdder starvationEvictionCount;
    private final LongAdder starvationInjectionCount;

    public ConcurrentStatsCounter() {
        this.putSuccessCount = new LongAdder();
        this.putDeniedCount = new LongAdder();
        this.putLostCount = new LongAdder();
        this.getSuccessCount = new LongAdder();
        this.getDeniedCount = new LongAdder();
        this.getLostCount = new LongAdder();
        this.slotSpinCount = new LongAdder();
        this.starvationEvictionCount = new LongAdder();
        this.starvationInjectionCount = new LongAdder();
    }

    @Override
    public void recordPut(Outcome outcome) {
        switch(outcome) {
            case SUCCESS:
                this.putSuccessCount.increment();
                return;
            case ADMISSION_DENIED:
                this.putDeniedCount.increment();
                return;
            case RESERVATION_LOST:
                this.putLostCount.increment();
                return;
            default:
                throw new IllegalArgumentException("Unknown outcome " + outcome);
        }
    }

    @Override
    public void recordGet(Outcome outcome) {
        switch(outcome) {
            case SUCCESS:
                this.getSuccessCount.increment();
                return;
            case ADMISSION_DENIED:
                this.getDeniedCount.increment();
                return;
            case RESERVATION_LOST:
                this.getLostCount.increment();
                return;
            default:
                throw new IllegalArgumentException("Unknown outcome " + outcome);
        }
    }

    @Override
    public void recordSlotSpins(int spins) {
        this.slotSpinCount.add(spins);
    }

    @Override
    public void recordStarvationEviction() {
        this.starvationEvictionCount.increment();
    }

    @Override
    public void recordStarvationInjection() {
        this.starvationInjectionCount.increment();
    }

    @Override
    public QueueStats snapshot() {
        return QueueStats.of(
            negativeToMaxValue(this.putSuccessCount.sum()),
            negativeToMaxValue(this.putDeniedCount.sum()),
            negativeToMaxValue(this.putLostCount.sum()),
            negativeToMaxValue(this.getSuccessCount.sum()),
            negativeToMaxValue(this.getDeniedCount.sum()),
            negativeToMaxValue(this.getLostCount.sum()),
            negativeToMaxValue(this.slotSpinCount.sum()),
            negativeToMaxValue(this.starvationEvictionCount.sum()),
            negativeToMaxValue(this.starvationInjectionCount.sum()));
    }

    /**
     * 将指定的StatsCounter里面的记录值累加进来
     */
    public void incrementBy(@NonNull StatsCounter other) {
        QueueStats snapshot = other.snapshot();
        this.putSuccessCount.add(snapshot.putSuccessCount());
        this.putDeniedCount.add(snapshot.putDeniedCount());
        this.putLostCount.add(snapshot.putLostCount());
        this.getSuccessCount.add(snapshot.getSuccessCount());
        this.getDeniedCount.add(snapshot.getDeniedCount());
        this.getLostCount.add(snapshot.getLostCount());
        this.slotSpinCount.add(snapshot.slotSpinCount());
        this.starvationEvictionCount.add(snapshot.starvationEvictionCount());
        this.starvationInjectionCount.add(snapshot.starvationInjectionCount());
    }

    private static long negativeToMaxValue(long value) {
        return (value >= 0) ? value : Long.MAX_VALUE;
    }

    @Override
    public String toString() {
        return this.snapshot().toString();
    }
}
