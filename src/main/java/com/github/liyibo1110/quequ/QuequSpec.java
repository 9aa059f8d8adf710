package com.github.liyibo1110.quequ;

import org.checkerframework.checker.nullness.qual.Nullable;

import java.util.Locale;
import java.util.Objects;

/**
 * Quequ实例的规范构建器，主要功能是能支持纯字符串格式的解析并构建过程
 * 例如：{@code capacity=1024,waitStrategy=backoff,starvationThreshold=200,recordStats}
 * @author liyibo
 * @date 2026-02-04 15:36
 */
public final class QuequSpec {
    static final String SPLIT_OPTIONS = ",";
    static final String SPLIT_KEY_VALUE = "=";

    final String specification;

    int capacity = Quequ.UNSET_INT;
    int minimumCapacity = Quequ.UNSET_INT;
    int starvationThreshold = Quequ.UNSET_INT;
    boolean recordStats;

    @Nullable WaitStrategy waitStrategy;

    private QuequSpec(String specification) {
        this.specification = Objects.requireNonNull(specification);
    }

    /**
     * 以自身的配置，来构建Quequ实例
     */
    Quequ<Object> toBuilder() {
        Quequ<Object> builder = Quequ.newBuilder();
        if(this.capacity != Quequ.UNSET_INT)
            builder.capacity(this.capacity);
        if(this.minimumCapacity != Quequ.UNSET_INT)
            builder.minimumCapacity(this.minimumCapacity);
        if(this.waitStrategy != null)
            builder.waitStrategy(this.waitStrategy);
        if(this.starvationThreshold != Quequ.UNSET_INT)
            builder.starvationThreshold(this.starvationThreshold);
        if(this.recordStats)
            builder.recordStats();
        return builder;
    }

    /**
     * 根据给定的配置字符串，构建QuequSpec实例
     */
    public static QuequSpec parse(String specification) {
        QuequSpec spec = new QuequSpec(specification);
        for(String option : specification.split(SPLIT_OPTIONS))
            spec.parseOption(option.trim());
        return spec;
    }

    /**
     * 解析每一个配置（即每个逗号分隔出来的部分）
     */
    void parseOption(String option) {
        if(option.isEmpty())
            return;
        String[] keyAndValue = option.split(SPLIT_KEY_VALUE);
        Quequ.requireArgument(keyAndValue.length <= 2,
                "key-value pair %s with more than one equals sign", option);

        String key = keyAndValue[0].trim();
        String value = (keyAndValue.length == 1) ? null : keyAndValue[1].trim();
        this.configure(key, value);
    }

    /**
     * 加载某个配置
     */
    void configure(String key, @Nullable String value) {
        switch(key) {
            case "capacity":
                this.capacity(key, value);
                return;
            case "minimumCapacity":
                this.minimumCapacity(key, value);
                return;
            case "waitStrategy":
                this.waitStrategy(key, value);
                return;
            case "starvationThreshold":
                this.starvationThreshold(key, value);
                return;
            case "recordStats":
                this.recordStats(value);
                return;
            default:
                throw new IllegalArgumentException("Unknown key " + key);
        }
    }

    void capacity(String key, @Nullable String value) {
        Quequ.requireArgument(this.capacity == Quequ.UNSET_INT,
                "capacity was already set to %,d", this.capacity);
        this.capacity = parseInt(key, value);
    }

    void minimumCapacity(String key, @Nullable String value) {
        Quequ.requireArgument(this.minimumCapacity == Quequ.UNSET_INT,
                "minimum capacity was already set to %,d", this.minimumCapacity);
        this.minimumCapacity = parseInt(key, value);
    }

    void waitStrategy(String key, @Nullable String value) {
        Quequ.requireArgument(this.waitStrategy == null, "wait strategy was already set to %s", this.waitStrategy);
        this.waitStrategy = parseWaitStrategy(key, value);
    }

    /**
     * 不带值时使用默认的自旋次数上限
     */
    void starvationThreshold(String key, @Nullable String value) {
        Quequ.requireArgument(this.starvationThreshold == Quequ.UNSET_INT,
                "starvation threshold was already set to %,d", this.starvationThreshold);
        this.starvationThreshold = (value == null)
                ? Quequ.DEFAULT_STARVATION_THRESHOLD
                : parseInt(key, value);
    }

    void recordStats(@Nullable String value) {
        Quequ.requireArgument(value == null, "record stats does not take a value");
        Quequ.requireArgument(!this.recordStats, "record stats was already set");
        this.recordStats = true;
    }

    /**
     * 将value转换成int
     */
    static int parseInt(String key, @Nullable String value) {
        Quequ.requireArgument(value != null && !value.isEmpty(), "value of key %s was omitted", key);
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(String.format(
                    "key %s value was set to %s, must be an integer", key, value), e);
        }
    }

    /**
     * 将value转换成WaitStrategy单例
     */
    static WaitStrategy parseWaitStrategy(String key, @Nullable String value) {
        Quequ.requireArgument(value != null && !value.isEmpty(), "value of key %s was omitted", key);
        switch(value.toLowerCase(Locale.US)) {
            case "yield":
                return WaitStrategy.yielding();
            case "spin":
                return WaitStrategy.spinning();
            case "backoff":
                return WaitStrategy.backingOff();
            default:
                throw new IllegalArgumentException(String.format(
                        "key %s invalid format; was %s, must be one of [yield, spin, backoff]", key, value));
        }
    }

    public String toParsableString() {
        return this.specification;
    }

    @Override
    public boolean equals(Object obj) {
        if(this == obj)
            return true;
        else if(!(obj instanceof QuequSpec))
            return false;
        QuequSpec spec = (QuequSpec)obj;
        return (this.capacity == spec.capacity)
                && (this.minimumCapacity == spec.minimumCapacity)
                && (this.starvationThreshold == spec.starvationThreshold)
                && (this.waitStrategy == spec.waitStrategy)
                && (this.recordStats == spec.recordStats);
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.capacity, this.minimumCapacity, this.starvationThreshold,
                this.waitStrategy, this.recordStats);
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + '{' + this.toParsableString() + '}';
    }
}
