package com.github.liyibo1110.quequ;

import com.github.liyibo1110.quequ.stats.QueueStats;
import com.github.liyibo1110.quequ.stats.StatsCounter;
import org.checkerframework.checker.nullness.qual.NonNull;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.lang.invoke.MethodHandles;
import java.lang.invoke.VarHandle;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 基于环形数组的无锁有界队列，支持任意数量的生产者和消费者同时调用
 * @author liyibo
 * @date 2026-02-05 10:32
 */
final class BoundedRingQueue<E> extends QQHeader.ReadAndWriteCursorRef implements RingQueue<E> {
    /*
     * 每个槽位有2个只增不减的代数：writeGeneration和readGeneration，合起来表示槽位在当前这一圈的状态：
     *   1、两者相等，并且等于某个游标值：槽位是空的，轮到这个游标值对应的put来写
     *   2、writeGeneration比readGeneration正好多出1圈（capacity）：槽位里有1个还没被读走的元素
     * 这样不需要额外的标志位，也不需要每圈清零，就能区分“这一圈还没写过”和“写过并且已经读走了”。
     *
     * put先快照两个游标做准入检查（预留2个槽位的余量），然后CAS把写游标加1，
     * 成功的线程独占了target = write + 1这个游标值，也就独占了slots[target & mask]在这一圈的写入权。
     * 接下来自旋等待槽位变成(target, target)，写入元素后把writeGeneration加上capacity来发布。
     * get完全对称：CAS读游标，等待槽位变成(target + capacity, target)，取出元素后把readGeneration加上capacity。
     *
     * 游标值0永远不会被预定（预定的都是cursor + 1），所以槽位i的初始代数是第一个映射到它的游标值：
     * 槽位0是capacity，其余是i。capacity整除2^32，所以游标回绕之后圈数的编码依旧成立。
     *
     * 元素字段只会被持有当前这一圈代数的那1个线程访问，所以本身是普通字段，
     * 可见性由两侧代数的volatile读和getAndAdd保证。
     */

    static final Logger logger = Logger.getLogger(BoundedRingQueue.class.getName());

    final int capacity;
    final int mask;
    final Slot[] slots;

    final WaitStrategy waitStrategy;
    final StatsCounter statsCounter;

    /** Quequ.UNSET_INT表示没有开启饥饿保护阀 */
    final int starvationThreshold;
    final @Nullable E starvationPlaceholder;
    final @Nullable EvictionListener<? super E> evictionListener;

    BoundedRingQueue(Quequ<E> builder) {
        this(builder, 0);
    }

    /**
     * @param initialCursor 两个游标的起始值，测试游标回绕时使用
     */
    BoundedRingQueue(Quequ<E> builder, int initialCursor) {
        super(initialCursor);
        this.capacity = builder.getCapacity();
        this.mask = this.capacity - 1;
        this.waitStrategy = builder.getWaitStrategy();
        this.statsCounter = builder.getStatsCounterSupplier().get();
        this.starvationThreshold = builder.starvationThreshold;
        this.starvationPlaceholder = builder.starvationPlaceholder;
        this.evictionListener = builder.evictionListener;

        this.slots = new Slot[this.capacity];
        int first = initialCursor + 1;
        for(int i = 0; i < this.capacity; i++) {
            // 第一个大于initialCursor并且落在槽位i上的游标值
            this.slots[i] = new Slot(first + ((i - first) & this.mask));
        }
    }

    /**
     * 根据游标快照估算元素数量，按32位回绕做减法，回绕前后结果一致
     * 快照随时会过期，只能用于准入检查和诊断，槽位上的代数才是唯一可信的依据
     */
    static int estimate(int read, int write) {
        return write - read;
    }

    @Override
    public PutResult put(@NonNull E element) {
        Objects.requireNonNull(element);
        int read = this.readCursor();
        int write = this.writeCursor();
        int count = estimate(read, write);
        if(Integer.compareUnsigned(count, this.capacity - 2) >= 0) {
            this.statsCounter.recordPut(Outcome.ADMISSION_DENIED);
            this.waitStrategy.idle(0);
            return PutResult.denied(count);
        }
        if(!this.casWriteCursor(write, write + 1)) {
            this.statsCounter.recordPut(Outcome.RESERVATION_LOST);
            this.waitStrategy.idle(0);
            return PutResult.lost(count);
        }

        int target = write + 1;
        Slot slot = this.slots[target & this.mask];
        int spins = 0;
        for(;;) {
            if(slot.isWritable(target)) {
                slot.element = element;
                slot.publish(this.capacity);
                this.recordSpins(spins);
                this.statsCounter.recordPut(Outcome.SUCCESS);
                return PutResult.success(count + 1);
            }
            // 上一圈的消费者还没有腾出这个槽位
            spins++;
            if(this.isStarved(spins))
                this.relieveStarvedProducer(target, spins);
            this.waitStrategy.idle(spins);
        }
    }

    @Override
    public GetResult<E> get() {
        int read = this.readCursor();
        int write = this.writeCursor();
        int count = estimate(read, write);
        if(count == 0) {
            this.statsCounter.recordGet(Outcome.ADMISSION_DENIED);
            this.waitStrategy.idle(0);
            return GetResult.denied(count);
        }
        if(!this.casReadCursor(read, read + 1)) {
            this.statsCounter.recordGet(Outcome.RESERVATION_LOST);
            this.waitStrategy.idle(0);
            return GetResult.lost(count);
        }

        int target = read + 1;
        Slot slot = this.slots[target & this.mask];
        int spins = 0;
        for(;;) {
            if(slot.isReadable(target, this.capacity)) {
                E element = this.take(slot);
                this.recordSpins(spins);
                this.statsCounter.recordGet(Outcome.SUCCESS);
                return GetResult.success(element, count - 1);
            }
            // 这一圈的生产者预定了槽位但还没有发布
            spins++;
            if(this.isStarved(spins))
                this.relieveStarvedConsumer(target, spins);
            this.waitStrategy.idle(spins);
        }
    }

    /**
     * 取走已发布的元素，并把槽位交给下一圈的put，调用方必须持有这一圈的读游标
     */
    E take(Slot slot) {
        @SuppressWarnings("unchecked")
        E element = (E)slot.element;
        slot.element = null;
        slot.release(this.capacity);
        return element;
    }

    boolean isStarved(int spins) {
        return (this.starvationThreshold != Quequ.UNSET_INT) && (spins % this.starvationThreshold == 0);
    }

    /**
     * 卡住的put强制取走最早的1个元素，交给EvictionListener
     * 只有下一个可读的槽位已经发布时才预定读游标，保护阀自己从不等待其他线程，
     * 否则两个卡住的生产者可能各自预定了对方的槽位，互相等待
     */
    void relieveStarvedProducer(int target, int spins) {
        int read = this.readCursor();
        int next = read + 1;
        if(next == target)
            return;
        Slot slot = this.slots[next & this.mask];
        if(!slot.isReadable(next, this.capacity) || !this.casReadCursor(read, next))
            return;

        E evicted = this.take(slot);
        this.statsCounter.recordGet(Outcome.SUCCESS);
        this.statsCounter.recordStarvationEviction();
        logger.log(Level.WARNING, "Producer starved on slot {0} after {1} spins, evicted one element",
                new Object[] {target & this.mask, spins});
        this.notifyEviction(evicted);
    }

    /**
     * 卡住的get强制放入1个占位元素，没有配置占位元素时只记录
     */
    void relieveStarvedConsumer(int target, int spins) {
        if(this.starvationPlaceholder == null) {
            logger.log(Level.WARNING, "Consumer starved on slot {0} after {1} spins",
                    new Object[] {target & this.mask, spins});
            return;
        }
        boolean injected = this.tryInject(this.starvationPlaceholder);
        if(injected)
            this.statsCounter.recordStarvationInjection();
        logger.log(Level.WARNING, "Consumer starved on slot {0} after {1} spins, placeholder injected: {2}",
                new Object[] {target & this.mask, spins, injected});
    }

    /**
     * 不等待的put：只有目标槽位在这一圈已经空出来时才预定写游标，做不到就放弃
     * 等待的话，放入的槽位可能还压着另一个卡住的消费者要读的元素
     */
    boolean tryInject(E element) {
        int read = this.readCursor();
        int write = this.writeCursor();
        if(Integer.compareUnsigned(estimate(read, write), this.capacity - 2) >= 0)
            return false;
        int target = write + 1;
        Slot slot = this.slots[target & this.mask];
        if(!slot.isWritable(target) || !this.casWriteCursor(write, target))
            return false;

        slot.element = element;
        slot.publish(this.capacity);
        this.statsCounter.recordPut(Outcome.SUCCESS);
        return true;
    }

    void notifyEviction(E evicted) {
        if(this.evictionListener == null)
            return;
        try {
            this.evictionListener.onEviction(evicted);
        } catch (Throwable t) {
            logger.log(Level.WARNING, "Exception thrown by eviction listener", t);
        }
    }

    void recordSpins(int spins) {
        if(spins > 0)
            this.statsCounter.recordSlotSpins(spins);
    }

    @Override
    public int capacity() {
        return this.capacity;
    }

    /**
     * 先读读游标再读写游标，并且读游标前后一致才采用，这样估算值只会偏大
     * 最后再把结果限制在[0, capacity)之内
     */
    @Override
    public int count() {
        int after = this.readCursor();
        int write;
        for(;;) {
            int before = after;
            write = this.writeCursor();
            after = this.readCursor();
            if(before == after)
                break;
        }
        int size = estimate(after, write);
        if(size < 0)
            return 0;
        return Math.min(size, this.mask);
    }

    @Override
    public QueueStats stats() {
        return this.statsCounter.snapshot();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + '{'
                + "capacity=" + this.capacity + ", "
                + "count=" + this.count()
                + '}';
    }

    /**
     * 环上的1个槽位
     */
    static final class Slot {
        static final VarHandle WRITE_GENERATION, READ_GENERATION;

        volatile int writeGeneration;
        volatile int readGeneration;
        @Nullable Object element;

        Slot(int generation) {
            this.writeGeneration = generation;
            this.readGeneration = generation;
        }

        /** 槽位是空的，并且轮到游标值generation对应的put来写 */
        boolean isWritable(int generation) {
            int writeGeneration = this.writeGeneration;
            return writeGeneration == generation && this.readGeneration == writeGeneration;
        }

        /** 槽位里有游标值generation对应的put发布的元素 */
        boolean isReadable(int generation, int lap) {
            int readGeneration = this.readGeneration;
            return readGeneration == generation && readGeneration + lap == this.writeGeneration;
        }

        /**
         * 写完元素之后调用，writeGeneration领先readGeneration 1圈，消费者就能看见这个元素
         */
        void publish(int lap) {
            WRITE_GENERATION.getAndAdd(this, lap);
        }

        /**
         * 取走元素之后调用，两个代数重新相等，槽位交给下一圈的生产者
         */
        void release(int lap) {
            READ_GENERATION.getAndAdd(this, lap);
        }

        static {
            MethodHandles.Lookup lookup = MethodHandles.lookup();
            try {
                WRITE_GENERATION = lookup.findVarHandle(Slot.class, "writeGeneration", int.class);
                READ_GENERATION = lookup.findVarHandle(Slot.class, "readGeneration", int.class);
            } catch (ReflectiveOperationException e) {
                throw new ExceptionInInitializerError(e);
            }
        }
    }
}
