package com.github.liyibo1110.quequ.stats;

import com.github.liyibo1110.quequ.Outcome;

/**
 * 不进行任何记录的StatsCounter实现
 * @author liyibo
 * @date 2026-02-06 13:44
 */
enum DisabledStatsCounter implements StatsCounter {
    INSTANCE;

    @Override
    public void recordPut(Outcome outcome) {}

    @Override
    public void recordGet(Outcome outcome) {}

    @Override
    public void recordSlotSpins(int spins) {}

    @Override
    public void recordStarvationEviction() {}

    @Override
    public void recordStarvationInjection() {}

    @Override
    public QueueStats snapshot() {
        return QueueStats.empty();
    }

    @Override
    public String toString() {
        return this.snapshot().toString();
    }
}
