package io.github.vevoly.petledger.core.clock;

import io.github.vevoly.petledger.api.LedgerClock;
import io.github.vevoly.petledger.api.constants.PetLedgerConstant;

import java.util.concurrent.atomic.AtomicLong;

/**
 * <h3>区块高度时钟 (Block Height Clock)</h3>
 *
 * <p>
 * 单调不减的逻辑时钟。由账本节点在封块时推进，测试中可手动推进。
 * </p>
 *
 * <hr>
 *
 * <span style="color: gray; font-size: 0.9em;">
 * <b>Block Height Clock.</b><br>
 * Monotonically non-decreasing logical clock. Advanced by the ledger node when a block is sealed,
 * or manually in tests.
 * </span>
 *
 * @author vevoly
 * @since 1.0.0
 */
public class BlockHeightClock implements LedgerClock {

    private final AtomicLong height;

    /**
     * 从第一个区块高度开始 (Starts at the first block height).
     */
    public BlockHeightClock() {
        this(PetLedgerConstant.FIRST_BLOCK_HEIGHT);
    }

    public BlockHeightClock(long initialHeight) {
        if (initialHeight < 0) {
            throw new IllegalArgumentException("Height must not be negative: " + initialHeight);
        }
        this.height = new AtomicLong(initialHeight);
    }

    @Override
    public long currentHeight() {
        return height.get();
    }

    /**
     * 推进一个高度 (Advance by one).
     *
     * @return 新高度 (The new height)
     */
    public long advance() {
        return height.incrementAndGet();
    }

    /**
     * 推进到指定高度 (Advance to the given height).
     *
     * @param target 目标高度，不得小于当前高度 / must not be lower than the current height
     * @throws IllegalArgumentException 时钟回退 / the clock would move backwards
     */
    public void advanceTo(long target) {
        height.updateAndGet(current -> {
            if (target < current) {
                throw new IllegalArgumentException(
                        String.format("Clock cannot move backwards: %d -> %d", current, target));
            }
            return target;
        });
    }
}
