package io.github.vevoly.petledger.api;

/**
 * 逻辑时钟 (Logical clock) 提供单调不减的区块高度，用于给活动打时间戳。
 * <br><span style="color: gray;">Supplies a monotonically non-decreasing block height used to timestamp activities.</span>
 *
 * @author vevoly
 * @since 1.0.0
 */
@FunctionalInterface
public interface LedgerClock {

    /**
     * 当前高度 (Current height).
     */
    long currentHeight();
}
