package org.jsdetect.error;

import java.util.concurrent.TimeUnit;

/**
 * 单个文件的分析截止时间，从任务真正开始执行时计时。
 * <p>
 * 长循环（作用域遍历、不动点迭代、路径枚举）定期调用 {@link #checkpoint()}，
 * 超时或线程被中断时抛出 {@link AnalysisTimeoutException}，已构建的部分结果随之丢弃。
 */
public final class Deadline {

    private static final Deadline NONE = new Deadline(Long.MAX_VALUE, 0);

    private final long deadlineNanos;
    private final long budgetMillis;

    private Deadline(long deadlineNanos, long budgetMillis) {
        this.deadlineNanos = deadlineNanos;
        this.budgetMillis = budgetMillis;
    }

    public static Deadline none() {
        return NONE;
    }

    /**
     * @param millis 允许的毫秒数，&lt;= 0 表示不限时
     */
    public static Deadline startingNow(long millis) {
        if (millis <= 0) {
            return NONE;
        }
        return new Deadline(System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(millis), millis);
    }

    public boolean isExpired() {
        return this != NONE && System.nanoTime() - deadlineNanos > 0;
    }

    public void checkpoint() {
        if (Thread.currentThread().isInterrupted()) {
            throw new AnalysisTimeoutException("Analysis interrupted");
        }
        if (isExpired()) {
            throw new AnalysisTimeoutException("Analysis exceeded " + budgetMillis + " ms");
        }
    }
}
