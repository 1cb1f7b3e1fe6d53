package io.github.vevoly.petledger.api;

import java.io.Serializable;

/**
 * <h3>交易去重策略接口 (Transaction Deduplication Strategy)</h3>
 *
 * <p>
 * 定义如何判断一笔交易（按 txHash）是否已被导入。
 * 框架内置了 LRU (精准但占内存) 和 BloomFilter (省内存但有误判) 两种实现，用户也可自定义。
 * </p>
 *
 * <hr>
 *
 * <span style="color: gray; font-size: 0.9em;">
 * <b>Transaction Deduplication Strategy.</b><br>
 * Decides whether a transaction (by txHash) was already imported.<br>
 * Built-in LRU and BloomFilter implementations are provided.
 * </span>
 *
 * @author vevoly
 * @since 1.0.0
 */
public interface IdempotencyStrategy extends Serializable {

    /**
     * 检查 Key 是否已存在.
     *
     * <span style="color: gray; font-size: 0.9em;">Check if the key exists.</span>
     *
     * @param key 交易哈希 (Transaction hash)
     * @return true=已存在(重复/Duplicate), false=不存在(New)
     */
    boolean contains(String key);

    /**
     * 记录 Key.
     *
     * <span style="color: gray; font-size: 0.9em;">Record the key.</span>
     *
     * @param key 交易哈希
     */
    void add(String key);

    /**
     * 获取策略名 (Get Strategy Name).
     */
    String getName();
}
