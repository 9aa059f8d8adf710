package com.github.liyibo1110.quequ.stats;

import com.github.liyibo1110.quequ.Outcome;

import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 对委托的StatsCounter实现进行代理的StatsCounter实现，负责吃掉异常并log输出
 * 用户自定义的计数器出错，不能影响put和get本身
 * @author liyibo
 * @date 2026-02-06 13:47
 */
final class GuardedStatsCounter implements StatsCounter {
    static final Logger logger = Logger.getLogger(GuardedStatsCounter.class.getName());

    final StatsCounter delegate;

    GuardedStatsCounter(StatsCounter delegate) {
        this.delegate = Objects.requireNonNull(delegate);
    }

    @Override
    public void recordPut(Outcome outcome) {
        try {
            this.delegate.recordPut(outcome);
        } catch (Throwable t) {
            logger.log(Level.WARNING, "Exception thrown by stats counter", t);
        }
    }

    @Override
    public void recordGet(Outcome outcome) {
        try {
            this.delegate.recordGet(outcome);
        } catch (Throwable t) {
            logger.log(Level.WARNING, "Exception thrown by stats counter", t);
        }
    }

    @Override
    public void recordSlotSpins(int spins) {
        try {
            this.delegate.recordSlotSpins(spins);
        } catch (Throwable t) {
            logger.log(Level.WARNING, "Exception thrown by stats counter", t);
        }
    }

    @Override
    public void recordStarvationEviction() {
        try {
            this.delegate.recordStarvationEviction();
        } catch (Throwable t) {
            logger.log(Level.WARNING, "Exception thrown by stats counter", t);
        }
    }

    @Override
    public void recordStarvationInjection() {
        try {
            this.delegate.recordStarvationInjection();
        } catch (Throwable t) {
            logger.log(Level.WARNING, "Exception thrown by stats counter", t);
        }
    }

    @Override
    public QueueStats snapshot() {
        try {
            return this.delegate.snapshot();
        } catch (Throwable t) {
            logger.log(Level.WARNING, "Exception thrown by stats counter", t);
            return QueueStats.empty();
        }
    }

    @Override
    public String toString() {
        return this.delegate.toString();
    }
}
