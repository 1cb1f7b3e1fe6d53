package io.github.vevoly.petledger.core.idempotency;

import io.github.vevoly.petledger.api.IdempotencyStrategy;
import io.github.vevoly.petledger.api.constants.PetLedgerConstant;

/**
 * 交易去重类型枚举 (Deduplication strategy type).
 *
 * @author vevoly
 */
public enum IdempotencyType {
    BLOOM, // 布隆过滤器，可能误拒新交易
    LRU;   // 精确，只覆盖最近 capacity 笔

    /**
     * 创建默认参数的策略实例 (Create a strategy with default sizing).
     */
    public IdempotencyStrategy create() {
        return create(PetLedgerConstant.DEFAULT_IDEMPOTENCY_CAPACITY, PetLedgerConstant.DEFAULT_BLOOM_FPP);
    }

    /**
     * @param capacity LRU 的容量，或布隆过滤器的预计插入数 (LRU capacity, or expected Bloom insertions)
     * @param fpp      布隆过滤器误判率，LRU 忽略 (Bloom false-positive rate, ignored by LRU)
     */
    public IdempotencyStrategy create(int capacity, double fpp) {
        return this == BLOOM ? new BloomIdempotencyStrategy(capacity, fpp) : new LruIdempotencyStrategy(capacity);
    }
}
