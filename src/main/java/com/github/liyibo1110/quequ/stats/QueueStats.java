package com.github.liyibo1110.quequ.stats;

import com.google.errorprone.annotations.Immutable;
import org.checkerframework.checker.index.qual.NonNegative;
import org.checkerframework.checker.nullness.qual.NonNull;

import java.util.Objects;

/**
 * 计数器快照
 * @author liyibo
 * @date 2026-02-06 14:05
 */
@Immutable
public final class QueueStats {
    private static final QueueStats EMPTY_STATS = QueueStats.of(0L, 0L, 0L, 0L, 0L, 0L, 0L, 0L, 0L);
    private final long putSuccessCount;
    private final long putDeniedCount;
    private final long putLostCount;
    private final long getSuccessCount;
    private final long getDeniedCount;
    private final long getLostCount;
    private final long slotSpinCount;
    private final long starvationEvictionCount;
    private final long starvationInjectionCount;

    private QueueStats(@NonNegative long putSuccessCount,
                       @NonNegative long putDeniedCount,
                       @NonNegative long putLostCount,
                       @NonNegative long getSuccessCount,
                       @NonNegative long getDeniedCount,
                       @NonNegative long getLostCount,
                       @NonNegative long slotSpinCount,
                       @NonNegative long starvationEvictionCount,
                       @NonNegative long starvationInjectionCount) {
        if((putSuccessCount < 0) || (putDeniedCount < 0) || (putLostCount < 0) ||
           (getSuccessCount < 0) || (getDeniedCount < 0) || (getLostCount < 0) ||
           (slotSpinCount < 0) || (starvationEvictionCount < 0) || (starvationInjectionCount < 0)) {
            throw new IllegalArgumentException();
        }
        this.putSuccessCount = putSuccessCount;
        this.putDeniedCount = putDeniedCount;
        this.putLostCount = putLostCount;
        this.getSuccessCount = getSuccessCount;
        this.getDeniedCount = getDeniedCount;
        this.getLostCount = getLostCount;
        this.slotSpinCount = slotSpinCount;
        this.starvationEvictionCount = starvationEvictionCount;
        this.starvationInjectionCount = starvationInjectionCount;
    }

    public static QueueStats of(@NonNegative long putSuccessCount,
                                @NonNegative long putDeniedCount,
                                @NonNegative long putLostCount,
                                @NonNegative long getSuccessCount,
                                @NonNegative long getDeniedCount,
                                @NonNegative long getLostCount,
                                @NonNegative long slotSpinCount,
                                @NonNegative long starvationEvictionCount,
                                @NonNegative long starvationInjectionCount) {
        return new QueueStats(putSuccessCount, putDeniedCount, putLostCount,
                getSuccessCount, getDeniedCount, getLostCount,
                slotSpinCount, starvationEvictionCount, starvationInjectionCount);
    }

    @NonNull
    public static QueueStats empty() {
        return EMPTY_STATS;
    }

    /**
     * 返回put的尝试总次数（成功 + 准入失败 + CAS失败）
     */
    @NonNegative
    public long putCount() {
        return saturatedAdd(saturatedAdd(this.putSuccessCount, this.putDeniedCount), this.putLostCount);
    }

    @NonNegative
    public long putSuccessCount() {
        return this.putSuccessCount;
    }

    @NonNegative
    public long putDeniedCount() {
        return this.putDeniedCount;
    }

    @NonNegative
    public long putLostCount() {
        return this.putLostCount;
    }

    @NonNegative
    public double putSuccessRate() {
        long putCount = this.putCount();
        return (putCount == 0) ? 1.0D : (double)this.putSuccessCount / putCount;
    }

    @NonNegative
    public long getCount() {
        return saturatedAdd(saturatedAdd(this.getSuccessCount, this.getDeniedCount), this.getLostCount);
    }

    @NonNegative
    public long getSuccessCount() {
        return this.getSuccessCount;
    }

    @NonNegative
    public long getDeniedCount() {
        return this.getDeniedCount;
    }

    @NonNegative
    public long getLostCount() {
        return this.getLostCount;
    }

    @NonNegative
    public double getSuccessRate() {
        long getCount = this.getCount();
        return (getCount == 0) ? 1.0D : (double)this.getSuccessCount / getCount;
    }

    /**
     * 返回CAS失败在所有尝试中的占比，可以粗略反映游标上的争用程度
     */
    @NonNegative
    public double contentionRate() {
        long attempts = saturatedAdd(this.putCount(), this.getCount());
        long lost = saturatedAdd(this.putLostCount, this.getLostCount);
        return (attempts == 0) ? 0.0D : (double)lost / attempts;
    }

    /**
     * 返回预定槽位之后，等待对方完成上一圈所自旋的总次数
     */
    @NonNegative
    public long slotSpinCount() {
        return this.slotSpinCount;
    }

    @NonNegative
    public long starvationEvictionCount() {
        return this.starvationEvictionCount;
    }

    @NonNegative
    public long starvationInjectionCount() {
        return this.starvationInjectionCount;
    }

    public QueueStats plus(@NonNull QueueStats other) {
        return QueueStats.of(
            saturatedAdd(this.putSuccessCount, other.putSuccessCount),
            saturatedAdd(this.putDeniedCount, other.putDeniedCount),
            saturatedAdd(this.putLostCount, other.putLostCount),
            saturatedAdd(this.getSuccessCount, other.getSuccessCount),
            saturatedAdd(this.getDeniedCount, other.getDeniedCount),
            saturatedAdd(this.getLostCount, other.getLostCount),
            saturatedAdd(this.slotSpinCount, other.slotSpinCount),
            saturatedAdd(this.starvationEvictionCount, other.starvationEvictionCount),
            saturatedAdd(this.starvationInjectionCount, other.starvationInjectionCount));
    }

    public QueueStats minus(@NonNull QueueStats other) {
        return QueueStats.of(
            Math.max(0L, saturatedSubtract(this.putSuccessCount, other.putSuccessCount)),
            Math.max(0L, saturatedSubtract(this.putDeniedCount, other.putDeniedCount)),
            Math.max(0L, saturatedSubtract(this.putLostCount, other.putLostCount)),
            Math.max(0L, saturatedSubtract(this.getSuccessCount, other.getSuccessCount)),
            Math.max(0L, saturatedSubtract(this.getDeniedCount, other.getDeniedCount)),
            Math.max(0L, saturatedSubtract(this.getLostCount, other.getLostCount)),
            Math.max(0L, saturatedSubtract(this.slotSpinCount, other.slotSpinCount)),
            Math.max(0L, saturatedSubtract(this.starvationEvictionCount, other.starvationEvictionCount)),
            Math.max(0L, saturatedSubtract(this.starvationInjectionCount, other.starvationInjectionCount)));
    }

    /**
     * 求和，如果上下溢出则返回最大或最小值
     */
    private static long saturatedAdd(long a, long b) {
        long naiveSum = a + b;
        if((a ^ b) < 0 | (a ^ naiveSum) >= 0)
            return naiveSum;
        return Long.MAX_VALUE + ((naiveSum >>> (Long.SIZE - 1)) ^ 1);
    }

    private static long saturatedSubtract(long a, long b) {
        long naiveDifference = a - b;
        if((a ^ b) >= 0 | (a ^ naiveDifference) >= 0)
            return naiveDifference;
        return Long.MAX_VALUE + ((naiveDifference >>> (Long.SIZE - 1)) ^ 1);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.putSuccessCount, this.putDeniedCount, this.putLostCount,
                this.getSuccessCount, this.getDeniedCount, this.getLostCount,
                this.slotSpinCount, this.starvationEvictionCount, this.starvationInjectionCount);
    }

    @Override
    public boolean equals(Object obj) {
        if(obj == this)
            return true;
        else if(!(obj instanceof QueueStats))
            return false;
        QueueStats other = (QueueStats)obj;
        return this.putSuccessCount == other.putSuccessCount &&
            this.putDeniedCount == other.putDeniedCount &&
            this.putLostCount == other.putLostCount &&
            this.getSuccessCount == other.getSuccessCount &&
            this.getDeniedCount == other.getDeniedCount &&
            this.getLostCount == other.getLostCount &&
            this.slotSpinCount == other.slotSpinCount &&
            this.starvationEvictionCount == other.starvationEvictionCount &&
            this.starvationInjectionCount == other.starvationInjectionCount;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + '{'
            + "putSuccessCount=" + this.putSuccessCount + ", "
            + "putDeniedCount=" + this.putDeniedCount + ", "
            + "putLostCount=" + this.putLostCount + ", "
            + "getSuccessCount=" + this.getSuccessCount + ", "
            + "getDeniedCount=" + this.getDeniedCount + ", "
            + "getLostCount=" + this.getLostCount + ", "
            + "slotSpinCount=" + this.slotSpinCount + ", "
            + "starvationEvictionCount=" + this.starvationEvictionCount + ", "
            + "starvationInjectionCount=" + this.starvationInjectionCount
            + '}';
    }
}
