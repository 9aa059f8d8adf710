package com.github.liyibo1110.quequ;

import com.github.liyibo1110.quequ.stats.ConcurrentStatsCounter;
import com.github.liyibo1110.quequ.stats.StatsCounter;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import org.checkerframework.checker.index.qual.NonNegative;
import org.checkerframework.checker.nullness.qual.NonNull;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Objects;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * RingQueue的builder类，以及static工具（注意Quequ本身就是Builder）
 * 例如：
 * <pre>{@code
 * RingQueue<String> queue = Quequ.newBuilder()
 *     .capacity(1000)
 *     .waitStrategy(WaitStrategy.backingOff())
 *     .recordStats()
 *     .build();
 * }</pre>
 * @author liyibo
 * @date 2026-02-04 10:20
 */
public final class Quequ<E> {
    static final Logger logger = Logger.getLogger(Quequ.class.getName());

    static final Supplier<StatsCounter> ENABLED_STATS_COUNTER_SUPPLIER = ConcurrentStatsCounter::new;

    static final int UNSET_INT = -1;

    /** 容量下限，环太小的话每次put和get都要在同一批槽位上争抢CAS */
    public static final int DEFAULT_MINIMUM_CAPACITY = 8;

    /** 需要保留2个槽位的安全余量，所以下限不能再小了 */
    static final int LOWEST_MINIMUM_CAPACITY = 4;

    /** int能表示的最大的2的幂，超过这个值的请求会被截断 */
    public static final int MAXIMUM_CAPACITY = 1 << 30;

    /** 开启饥饿保护阀时，默认的槽位自旋次数上限 */
    public static final int DEFAULT_STARVATION_THRESHOLD = 100;

    boolean strictParsing = true;

    int capacity = UNSET_INT;
    int minimumCapacity = UNSET_INT;
    int starvationThreshold = UNSET_INT;

    @Nullable WaitStrategy waitStrategy;
    @Nullable E starvationPlaceholder;
    @Nullable EvictionListener<? super E> evictionListener;
    @Nullable Supplier<StatsCounter> statsCounterSupplier;

    private Quequ() {}

    /**
     * 确保expression为true，否则抛IllegalArgumentException异常
     */
    static void requireArgument(boolean expression) {
        if(!expression)
            throw new IllegalArgumentException();
    }

    /**
     * 确保expression为true，否则抛IllegalArgumentException异常
     */
    static void requireArgument(boolean expression, String template, @Nullable Object... args) {
        if(!expression)
            throw new IllegalArgumentException(String.format(template, args));
    }

    /**
     * 确保expression为true，否则抛IllegalStateException异常
     */
    static void requireState(boolean expression) {
        if(!expression)
            throw new IllegalStateException();
    }

    /**
     * 确保expression为true，否则抛IllegalStateException异常（带自定义信息）
     */
    static void requireState(boolean expression, String template, @Nullable Object... args) {
        if(!expression)
            throw new IllegalStateException(String.format(template, args));
    }

    /**
     * 返回大于或等于x的最小2次幂
     * 比如1 -> 1，10 -> 16，100 -> 128
     */
    static int ceilingPowerOfTwo(int x) {
        // From Hacker's Delight, Chapter 3, Harry S. Warren Jr.
        return 1 << -Integer.numberOfLeadingZeros(x - 1);
    }

    /**
     * 返回真实容量：不小于max(requested, minimum)的最小2次幂
     * requested不是正数时直接使用minimum，到达MAXIMUM_CAPACITY之后不再取整，避免溢出成0
     */
    static int resolveCapacity(int requested, int minimum) {
        int capacity = Math.max(requested, minimum);
        if(capacity >= MAXIMUM_CAPACITY)
            return MAXIMUM_CAPACITY;
        return ceilingPowerOfTwo(capacity);
    }

    /**
     * 返回空的builder
     */
    public static Quequ<Object> newBuilder() {
        return new Quequ<>();
    }

    /**
     * 使用默认配置直接构建队列，requestedCapacity不是正数时使用容量下限
     */
    public static <E> RingQueue<E> newQueue(int requestedCapacity) {
        Quequ<Object> builder = newBuilder();
        if(requestedCapacity > 0)
            builder.capacity(requestedCapacity);
        return builder.build();
    }

    /**
     * 从QuequSpec实例中生成Quequ实例
     */
    public static Quequ<Object> from(QuequSpec spec) {
        Quequ<Object> builder = spec.toBuilder();
        builder.strictParsing = false;
        return builder;
    }

    /**
     * 从配置字符串中生成Quequ实例
     */
    public static Quequ<Object> from(String spec) {
        return from(QuequSpec.parse(spec));
    }

    /**
     * 期望的容量，最终会被向上取整成2的幂
     */
    @CanIgnoreReturnValue
    public Quequ<E> capacity(@NonNegative int capacity) {
        requireState(this.capacity == UNSET_INT, "capacity was already set to %s", this.capacity);
        requireArgument(capacity > 0, "capacity must be positive: %s", capacity);
        this.capacity = capacity;
        return this;
    }

    @CanIgnoreReturnValue
    public Quequ<E> minimumCapacity(@NonNegative int minimumCapacity) {
        requireState(this.minimumCapacity == UNSET_INT,
                "minimum capacity was already set to %s", this.minimumCapacity);
        requireArgument(minimumCapacity >= LOWEST_MINIMUM_CAPACITY,
                "minimum capacity must be at least %s: %s", LOWEST_MINIMUM_CAPACITY, minimumCapacity);
        requireArgument(minimumCapacity <= MAXIMUM_CAPACITY,
                "minimum capacity must not exceed %s: %s", MAXIMUM_CAPACITY, minimumCapacity);
        this.minimumCapacity = minimumCapacity;
        return this;
    }

    int getMinimumCapacity() {
        return (this.minimumCapacity == UNSET_INT) ? DEFAULT_MINIMUM_CAPACITY : this.minimumCapacity;
    }

    int getCapacity() {
        int requested = (this.capacity == UNSET_INT) ? 0 : this.capacity;
        return resolveCapacity(requested, this.getMinimumCapacity());
    }

    @CanIgnoreReturnValue
    public Quequ<E> waitStrategy(@NonNull WaitStrategy waitStrategy) {
        requireState(this.waitStrategy == null, "wait strategy was already set to %s", this.waitStrategy);
        this.waitStrategy = Objects.requireNonNull(waitStrategy);
        return this;
    }

    WaitStrategy getWaitStrategy() {
        return (this.waitStrategy == null) ? WaitStrategy.yielding() : this.waitStrategy;
    }

    /**
     * 开启饥饿保护阀：槽位自旋超过spins次之后，强制执行一次相反的操作
     * 这是有损的行为，生产者一侧会丢弃最早的元素，消费者一侧会放入占位元素
     */
    @CanIgnoreReturnValue
    public Quequ<E> starvationThreshold(@NonNegative int spins) {
        requireState(this.starvationThreshold == UNSET_INT,
                "starvation threshold was already set to %s", this.starvationThreshold);
        requireArgument(spins > 0, "starvation threshold must be positive: %s", spins);
        this.starvationThreshold = spins;
        return this;
    }

    boolean hasStarvationValve() {
        return this.starvationThreshold != UNSET_INT;
    }

    /**
     * 卡住的消费者强制放入的占位元素，不设置时消费者一侧只计数，继续等待
     */
    @CanIgnoreReturnValue
    public <E1 extends E> Quequ<E1> starvationPlaceholder(@NonNull E1 placeholder) {
        requireState(this.starvationPlaceholder == null,
                "starvation placeholder was already set to %s", this.starvationPlaceholder);

        @SuppressWarnings("unchecked")
        Quequ<E1> self = (Quequ<E1>)this;
        self.starvationPlaceholder = Objects.requireNonNull(placeholder);
        return self;
    }

    @CanIgnoreReturnValue
    public <E1 extends E> Quequ<E1> evictionListener(@NonNull EvictionListener<? super E1> evictionListener) {
        requireState(this.evictionListener == null,
                "eviction listener was already set to %s", this.evictionListener);

        @SuppressWarnings("unchecked")
        Quequ<E1> self = (Quequ<E1>)this;
        self.evictionListener = Objects.requireNonNull(evictionListener);
        return self;
    }

    @CanIgnoreReturnValue
    public Quequ<E> recordStats() {
        requireState(this.statsCounterSupplier == null, "Statistics recording was already set");
        this.statsCounterSupplier = ENABLED_STATS_COUNTER_SUPPLIER;
        return this;
    }

    @CanIgnoreReturnValue
    public Quequ<E> recordStats(@NonNull Supplier<? extends StatsCounter> statsCounterSupplier) {
        requireState(this.statsCounterSupplier == null, "Statistics recording was already set");
        Objects.requireNonNull(statsCounterSupplier);
        this.statsCounterSupplier = () -> StatsCounter.guardedStatsCounter(statsCounterSupplier.get());
        return this;
    }

    Supplier<StatsCounter> getStatsCounterSupplier() {
        return (this.statsCounterSupplier == null)
                ? StatsCounter::disabledStatsCounter
                : this.statsCounterSupplier;
    }

    public <E1 extends E> RingQueue<E1> build() {
        this.requireValveForPlaceholder();

        @SuppressWarnings("unchecked")
        Quequ<E1> self = (Quequ<E1>)this;
        return new BoundedRingQueue<>(self);
    }

    void requireValveForPlaceholder() {
        if(this.starvationPlaceholder == null && this.evictionListener == null)
            return;
        if(this.strictParsing) {
            requireState(this.hasStarvationValve(),
                    "starvation placeholder and eviction listener require starvationThreshold");
        }else if(!this.hasStarvationValve()) {
            logger.log(Level.WARNING, "ignoring starvation settings specified without starvationThreshold");
        }
    }

    @Override
    public String toString() {
        StringBuilder s = new StringBuilder(64);
        s.append(getClass().getSimpleName()).append('{');
        int baseLength = s.length();
        if(this.capacity != UNSET_INT)
            s.append("capacity=").append(this.capacity).append(", ");
        if(this.minimumCapacity != UNSET_INT)
            s.append("minimumCapacity=").append(this.minimumCapacity).append(", ");
        if(this.waitStrategy != null)
            s.append("waitStrategy=").append(this.waitStrategy.getClass().getSimpleName()).append(", ");
        if(this.starvationThreshold != UNSET_INT)
            s.append("starvationThreshold=").append(this.starvationThreshold).append(", ");
        if(this.starvationPlaceholder != null)
            s.append("starvationPlaceholder, ");
        if(this.evictionListener != null)
            s.append("evictionListener, ");
        if(this.statsCounterSupplier != null)
            s.append("recordStats, ");

        if(s.length() > baseLength)
            s.setLength(s.length() - 2);

        return s.append('}').toString();
    }
}
