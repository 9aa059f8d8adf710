package com.github.liyibo1110.quequ;

import org.checkerframework.checker.nullness.qual.NonNull;
import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Objects;

/**
 * get的返回值，包含取出的元素、结果以及近似的元素数量
 * 是否成功只由槽位的代数协议决定，和元素本身的值无关
 * @author liyibo
 * @date 2026-02-03 10:41
 */
public final class GetResult<E> {
    private final @Nullable E value;
    private final Outcome outcome;
    private final int count;

    private GetResult(@Nullable E value, Outcome outcome, int count) {
        this.value = value;
        this.outcome = outcome;
        this.count = count;
    }

    static <E> GetResult<E> success(@NonNull E value, int count) {
        return new GetResult<>(Objects.requireNonNull(value), Outcome.SUCCESS, count);
    }

    static <E> GetResult<E> denied(int count) {
        return new GetResult<>(null, Outcome.ADMISSION_DENIED, count);
    }

    static <E> GetResult<E> lost(int count) {
        return new GetResult<>(null, Outcome.RESERVATION_LOST, count);
    }

    /**
     * 失败时返回null
     */
    public @Nullable E value() {
        return this.value;
    }

    public boolean ok() {
        return this.outcome == Outcome.SUCCESS;
    }

    public int count() {
        return this.count;
    }

    @NonNull
    public Outcome outcome() {
        return this.outcome;
    }

    @Override
    public boolean equals(Object obj) {
        if(obj == this)
            return true;
        else if(!(obj instanceof GetResult))
            return false;
        GetResult<?> other = (GetResult<?>)obj;
        return Objects.equals(this.value, other.value)
                && this.outcome == other.outcome
                && this.count == other.count;
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.value, this.outcome, this.count);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + '{'
                + "value=" + this.value + ", "
                + "outcome=" + this.outcome + ", "
                + "count=" + this.count
                + '}';
    }
}
