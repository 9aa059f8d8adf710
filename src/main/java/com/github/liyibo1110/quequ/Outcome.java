package com.github.liyibo1110.quequ;

/**
 * 一次put或get尝试的结果，失败都不是异常，调用方自己决定重试、退避还是放弃
 * @author liyibo
 * @date 2026-02-03 10:12
 */
public enum Outcome {
    /**
     * 成功预定了游标，并且完成了槽位的写入或读取
     */
    SUCCESS {
        @Override
        public boolean madeProgress() {
            return true;
        }
    },

    /**
     * 快速准入检查失败：put时队列看起来已满，get时队列看起来为空，没有修改任何共享状态
     */
    ADMISSION_DENIED {
        @Override
        public boolean madeProgress() {
            return false;
        }
    },

    /**
     * 游标的CAS被其他并发调用方抢先了，除了对方的推进之外没有修改任何共享状态
     */
    RESERVATION_LOST {
        @Override
        public boolean madeProgress() {
            return false;
        }
    };

    /**
     * 本次尝试是否真正转移了一个元素
     */
    public abstract boolean madeProgress();
}
