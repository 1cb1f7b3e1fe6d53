package io.github.vevoly.petledger.core.snapshot;

import io.github.vevoly.petledger.api.IdempotencyStrategy;
import io.github.vevoly.petledger.api.tx.BlockRef;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serial;
import java.io.Serializable;

/**
 * <h3>快照数据包装器 (Snapshot Data Wrapper)</h3>
 *
 * <p>
 * 包含了恢复账本所需的所有信息：链头位置、账本状态、去重策略状态。
 * </p>
 *
 * <hr>
 *
 * <span style="color: gray; font-size: 0.9em;">
 * <b>Snapshot Data Wrapper.</b><br>
 * Contains everything needed to restore the ledger: chain head, ledger state and deduplication state.
 * </span>
 *
 * @param <S> 账本状态类型 (Ledger State Type)
 * @author vevoly
 * @since 1.0.0
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SnapshotContainer<S> implements Serializable {
    @Serial
    private static final long serialVersionUID = 1L;

    /**
     * 快照时刻的链头高度 (恢复后从 height+1 继续出块).
     * <br>
     * <span style="color: gray;">Head height at snapshot time (block production resumes at height+1).</span>
     */
    private long headHeight;

    /**
     * 快照时刻的链头哈希.
     * <br>
     * <span style="color: gray;">Head hash at snapshot time.</span>
     */
    private String headHash;

    /**
     * 账本状态 (所有权索引与活动时间).
     * <br>
     * <span style="color: gray;">Ledger state (ownership index and activity times).</span>
     */
    private S state;

    /**
     * 交易去重策略的状态 (BloomFilter 或 LRU).
     * <br>
     * <span style="color: gray;">State of the deduplication strategy (BloomFilter or LRU).</span>
     */
    private IdempotencyStrategy idempotencyStrategy;

    public BlockRef getHead() {
        return new BlockRef(headHeight, headHash);
    }
}
