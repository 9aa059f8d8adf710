package com.github.liyibo1110.quequ;

import com.github.liyibo1110.quequ.stats.QueueStats;
import org.checkerframework.checker.index.qual.NonNegative;
import org.checkerframework.checker.nullness.qual.NonNull;

/**
 * 容量固定的无锁多生产者多消费者队列
 * put和get都是单次的非阻塞尝试，失败时不会抛异常，而是返回没有进展的结果，由调用方决定重试策略
 * 实例本身就是共享状态的唯一持有者，只能传引用
 * @author liyibo
 * @date 2026-02-03 11:02
 */
public interface RingQueue<E> {

    /**
     * 尝试放入元素，成功后element的所有权就转移给了队列
     * @throws NullPointerException element为null
     */
    @NonNull
    PutResult put(@NonNull E element);

    /**
     * 尝试取出最早预定成功的那个元素
     */
    @NonNull
    GetResult<E> get();

    /**
     * 返回固定的容量（2的幂）
     */
    @NonNegative
    int capacity();

    /**
     * 返回近似的元素数量，并发下随时会过期，只能用于诊断，范围是[0, capacity)
     */
    @NonNegative
    int count();

    default boolean isEmpty() {
        return this.count() == 0;
    }

    /**
     * 返回统计快照，没有开启recordStats时全部为0
     */
    @NonNull
    QueueStats stats();
}
