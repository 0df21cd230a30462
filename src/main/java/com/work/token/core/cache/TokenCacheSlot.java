package com.work.token.core.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 单个 token 规格独占的 TTL 缓存槽：最近一次生成的值 + 写入时刻，由一把锁保护。
 *
 * 约束：
 * - 锁只覆盖拷入/拷出，绝不覆盖随机数生成与编码
 * - 获取锁失败（超时/中断）按未命中处理，不阻塞、不抛出
 * - 并发写入时后写者胜出；同一 TTL 窗口内重复生成是允许的（值只在随机性上不同）
 */
public class TokenCacheSlot {

    private static final Logger log = LoggerFactory.getLogger(TokenCacheSlot.class);

    /**
     * 读结果分类，区分普通未命中与需要上报的降级场景。
     */
    public enum Outcome {
        HIT, MISS, EXPIRED, CLOCK_SKEW, LOCK_FAILED
    }

    /**
     * 一次读操作的结果；仅 HIT 时携带值。
     */
    public static final class Read {

        private static final Read MISS = new Read(Outcome.MISS, null);
        private static final Read EXPIRED = new Read(Outcome.EXPIRED, null);
        private static final Read CLOCK_SKEW = new Read(Outcome.CLOCK_SKEW, null);
        private static final Read LOCK_FAILED = new Read(Outcome.LOCK_FAILED, null);

        private final Outcome outcome;
        private final String value;

        private Read(Outcome outcome, String value) {
            this.outcome = outcome;
            this.value = value;
        }

        public Outcome getOutcome() {
            return outcome;
        }

        public Optional<String> getValue() {
            return Optional.ofNullable(value);
        }

        public boolean isHit() {
            return outcome == Outcome.HIT;
        }
    }

    private final ReentrantLock lock = new ReentrantLock();

    private String value;
    private Instant writtenAt;

    /**
     * 读路径：在 TTL 窗口内拷出缓存值。
     *
     * @param now        本次生成共用的时间采样
     * @param ttlSeconds 必须 > 0，否则直接视为未命中
     * @param lockWait   获取锁的最长等待
     */
    public Read read(Instant now, int ttlSeconds, Duration lockWait) {
        if (ttlSeconds <= 0 || now == null) {
            return Read.MISS;
        }
        if (!acquire(lockWait)) {
            return Read.LOCK_FAILED;
        }
        try {
            if (value == null || writtenAt == null) {
                return Read.MISS;
            }
            Duration elapsed = Duration.between(writtenAt, now);
            if (elapsed.isNegative()) {
                // 时钟回拨：正的 TTL 判定已不可信，直接作废
                log.warn("token cache invalidated, clock moved backward writtenAt={} now={}", writtenAt, now);
                clear();
                return Read.CLOCK_SKEW;
            }
            if (elapsed.compareTo(Duration.ofSeconds(ttlSeconds)) < 0) {
                return new Read(Outcome.HIT, value);
            }
            return Read.EXPIRED;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 写路径：保存新值与写入时刻。获取锁失败时放弃写入并返回 false。
     */
    public boolean write(String newValue, Instant now, Duration lockWait) {
        if (newValue == null || now == null) {
            return false;
        }
        if (!acquire(lockWait)) {
            return false;
        }
        try {
            this.value = newValue;
            this.writtenAt = now;
            return true;
        } finally {
            lock.unlock();
        }
    }

    private void clear() {
        this.value = null;
        this.writtenAt = null;
    }

    private boolean acquire(Duration lockWait) {
        long waitNanos = lockWait == null ? 0L : Math.max(0L, lockWait.toNanos());
        try {
            if (lock.tryLock(waitNanos, TimeUnit.NANOSECONDS)) {
                return true;
            }
            log.debug("token cache lock not acquired within {}", lockWait);
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("token cache lock wait interrupted");
            return false;
        }
    }
}
