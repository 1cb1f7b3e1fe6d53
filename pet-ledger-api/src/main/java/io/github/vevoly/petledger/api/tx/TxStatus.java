package io.github.vevoly.petledger.api.tx;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * <h3>交易状态 (Transaction Status)</h3>
 *
 * <p>
 * 提交后的观察顺序：{@code READY → (IN_BLOCK) → FINALIZED | DROPPED | INVALID | ERROR}。
 * 非终态可以重复或被跳过，终态结束整个状态流。
 * </p>
 *
 * <hr>
 *
 * <span style="color: gray; font-size: 0.9em;">
 * <b>Transaction Status.</b><br>
 * Observation order: {@code READY → (IN_BLOCK) → FINALIZED | DROPPED | INVALID | ERROR}.
 * Non-terminal statuses may repeat or be skipped; a terminal status ends the stream.
 * </span>
 *
 * @author vevoly
 * @since 1.0.0
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class TxStatus {

    public enum Kind {
        /** 已进入待打包池 / accepted into the pending pool */
        READY(false),
        /** 已被打包进区块，但尚未最终确认 / included, not yet final */
        IN_BLOCK(false),
        /** 所在区块已最终确认 / the including block is final */
        FINALIZED(true),
        /** 被交易池丢弃 / dropped from the pool */
        DROPPED(true),
        /** 交易无效 / invalid transaction */
        INVALID(true),
        /** 传输层错误 / transport error */
        ERROR(true);

        private final boolean terminal;

        Kind(boolean terminal) {
            this.terminal = terminal;
        }

        public boolean isTerminal() {
            return terminal;
        }
    }

    Kind kind;
    BlockRef block;
    String detail;

    public static TxStatus ready() {
        return new TxStatus(Kind.READY, null, null);
    }

    public static TxStatus inBlock(BlockRef block) {
        return new TxStatus(Kind.IN_BLOCK, block, null);
    }

    public static TxStatus finalized(BlockRef block) {
        return new TxStatus(Kind.FINALIZED, block, null);
    }

    public static TxStatus dropped(String detail) {
        return new TxStatus(Kind.DROPPED, null, detail);
    }

    public static TxStatus invalid(String reason) {
        return new TxStatus(Kind.INVALID, null, reason);
    }

    public static TxStatus error(String detail) {
        return new TxStatus(Kind.ERROR, null, detail);
    }

    public boolean isTerminal() {
        return kind.isTerminal();
    }
}
