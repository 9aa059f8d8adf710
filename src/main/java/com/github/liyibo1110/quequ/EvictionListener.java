package com.github.liyibo1110.quequ;

import org.checkerframework.checker.nullness.qual.NonNull;

/**
 * 饥饿保护阀强制取走元素时触发的监听器
 * 实现类应避免执行阻塞调用，抛出的异常只会被记录日志
 * @author liyibo
 * @date 2026-02-05 16:20
 */
@FunctionalInterface
public interface EvictionListener<E> {

    /**
     * 卡住的生产者为了自救而丢弃了element
     */
    void onEviction(@NonNull E element);
}
