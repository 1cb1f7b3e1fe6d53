package io.github.vevoly.petledger.core.idempotency;

import com.google.common.hash.BloomFilter;
import com.google.common.hash.Funnels;
import io.github.vevoly.petledger.api.IdempotencyStrategy;
import io.github.vevoly.petledger.api.constants.PetLedgerConstant;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.Serial;
import java.nio.charset.StandardCharsets;

/**
 * <h3>基于布隆过滤器的交易准入去重 (Bloom Filter Tx Admission)</h3>
 *
 * <p>
 * 记录所有已准入的交易哈希，内存占用与交易数无关，只取决于预计容量与误判率。
 * 误判只会发生在"已见过"一侧：一笔从未提交过的新交易有 {@code fpp} 的概率被判定为重复，
 * 在准入时得到 {@code INVALID (DUPLICATE_TRANSACTION)}，客户端需要用新的 txId 重新提交。
 * 重复交易永远不会被放行。
 * </p>
 *
 * <p>
 * 过滤器随快照一起保存，重启后恢复的是快照中的过滤器，而不是按当前配置新建的空过滤器。
 * 实际插入数超过预计容量后误判率会上升，此时记录一次告警。
 * </p>
 *
 * <hr>
 *
 * <span style="color: gray; font-size: 0.9em;">
 * <b>Bloom Filter Tx Admission.</b><br>
 * Remembers every admitted tx hash in constant memory sized by expected insertions and false-positive rate.
 * A false positive turns a fresh transaction into {@code INVALID (DUPLICATE_TRANSACTION)}, and the client must
 * resubmit with a new txId. A real duplicate is never admitted.<br>
 * The filter is part of the snapshot; a restart restores it instead of building an empty one from configuration.
 * </span>
 *
 * @author vevoly
 * @since 1.0.0
 */
@Slf4j
public class BloomIdempotencyStrategy implements IdempotencyStrategy {
    @Serial
    private static final long serialVersionUID = 1L;

    private final BloomFilter<CharSequence> seen;
    @Getter
    private final int expectedInsertions;
    @Getter
    private final double fpp;
    private boolean saturationReported;

    public BloomIdempotencyStrategy() {
        this(PetLedgerConstant.DEFAULT_IDEMPOTENCY_CAPACITY, PetLedgerConstant.DEFAULT_BLOOM_FPP);
    }

    /**
     * @param expectedInsertions 预计准入的交易数 (Expected number of admitted transactions)
     * @param fpp                新交易被误拒的概率 (Probability that a fresh tx is rejected), 0 &lt; fpp &lt; 1
     */
    public BloomIdempotencyStrategy(int expectedInsertions, double fpp) {
        if (expectedInsertions <= 0) {
            throw new IllegalArgumentException("Expected insertions must be greater than 0");
        }
        if (!(fpp > 0.0 && fpp < 1.0)) {
            throw new IllegalArgumentException("False positive probability must be in (0, 1)");
        }
        this.expectedInsertions = expectedInsertions;
        this.fpp = fpp;
        this.seen = BloomFilter.create(Funnels.stringFunnel(StandardCharsets.UTF_8), expectedInsertions, fpp);
    }

    @Override
    public boolean contains(String txHash) {
        return seen.mightContain(txHash);
    }

    @Override
    public void add(String txHash) {
        seen.put(txHash);
        if (!saturationReported && seen.approximateElementCount() > expectedInsertions) {
            saturationReported = true;
            log.warn("去重过滤器已超出预计容量 {}，新交易误拒率将高于 {} / Bloom filter past expected insertions, "
                    + "fresh transactions may be rejected more often", expectedInsertions, fpp);
        }
    }

    /**
     * 当前误判率估计 (Current estimated false-positive rate).
     */
    public double expectedFpp() {
        return seen.expectedFpp();
    }

    @Override
    public String getName() {
        return IdempotencyType.BLOOM.name();
    }
}
