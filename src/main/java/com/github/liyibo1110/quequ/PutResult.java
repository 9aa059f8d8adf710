package com.github.liyibo1110.quequ;

import com.google.errorprone.annotations.Immutable;
import org.checkerframework.checker.nullness.qual.NonNull;

import java.util.Objects;

/**
 * put的返回值，包含结果以及近似的元素数量
 * 成功时count为放入之后的估算值，失败时为准入检查时看到的估算值
 * @author liyibo
 * @date 2026-02-03 10:30
 */
@Immutable
public final class PutResult {
    private final Outcome outcome;
    private final int count;

    private PutResult(Outcome outcome, int count) {
        this.outcome = outcome;
        this.count = count;
    }

    static PutResult success(int count) {
        return new PutResult(Outcome.SUCCESS, count);
    }

    static PutResult denied(int count) {
        return new PutResult(Outcome.ADMISSION_DENIED, count);
    }

    static PutResult lost(int count) {
        return new PutResult(Outcome.RESERVATION_LOST, count);
    }

    /**
     * 为false时说明没有任何进展，调用方需要重试或者退避
     */
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
        else if(!(obj instanceof PutResult))
            return false;
        PutResult other = (PutResult)obj;
        return this.outcome == other.outcome && this.count == other.count;
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.outcome, this.count);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + '{' + "outcome=" + this.outcome + ", count=" + this.count + '}';
    }
}
