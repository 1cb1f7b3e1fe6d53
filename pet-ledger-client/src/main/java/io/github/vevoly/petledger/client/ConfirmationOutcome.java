package io.github.vevoly.petledger.client;

import io.github.vevoly.petledger.api.event.PetEvent;
import io.github.vevoly.petledger.api.exception.PetLedgerErrorCode;
import io.github.vevoly.petledger.api.tx.BlockRef;
import io.github.vevoly.petledger.api.tx.TxStatus;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * <h3>确认结果 (Confirmation Outcome)</h3>
 *
 * <p>
 * 确认监听器的最终结论。只有 {@link Kind#FINALIZED} 代表可信的成功；
 * {@link Kind#NO_MATCHING_EVENT} 与 {@link Kind#INDETERMINATE} 表示影响未知，
 * 调用方必须重新查询账本状态，不能当作成功或失败处理。
 * </p>
 *
 * <hr>
 *
 * <span style="color: gray; font-size: 0.9em;">
 * <b>Confirmation Outcome.</b><br>
 * Final verdict of the confirmation watcher. Only {@link Kind#FINALIZED} is a trusted success.
 * {@link Kind#NO_MATCHING_EVENT} and {@link Kind#INDETERMINATE} mean the effect is unknown:
 * re-query the ledger, never assume either way.
 * </span>
 *
 * @author vevoly
 * @since 1.0.0
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ConfirmationOutcome {

    public enum Kind {
        /** 已最终确认，并找到匹配事件 / final, matching event found */
        FINALIZED,
        /** 已最终确认，但找不到匹配事件 / final, but no matching event */
        NO_MATCHING_EVENT,
        /** 已打包，但调度失败 / included, but the dispatch failed */
        DISPATCH_FAILED,
        /** 被传输层拒绝 (DROPPED / INVALID / ERROR) / rejected by the transport */
        REJECTED,
        /** 流在终态前结束或等待超时 / stream ended before a terminal status, or timed out */
        INDETERMINATE
    }

    Kind kind;
    String txHash;
    BlockRef block;
    PetEvent event;
    PetLedgerErrorCode error;
    TxStatus status;
    String detail;

    public static ConfirmationOutcome finalized(String txHash, BlockRef block, PetEvent event) {
        return new ConfirmationOutcome(Kind.FINALIZED, txHash, block, event, null, null, null);
    }

    public static ConfirmationOutcome noMatchingEvent(String txHash, BlockRef block, String detail) {
        return new ConfirmationOutcome(Kind.NO_MATCHING_EVENT, txHash, block, null, null, null, detail);
    }

    public static ConfirmationOutcome dispatchFailed(String txHash, BlockRef block, PetLedgerErrorCode error) {
        return new ConfirmationOutcome(Kind.DISPATCH_FAILED, txHash, block, null, error, null,
                error == null ? null : error.getDefaultMessage());
    }

    public static ConfirmationOutcome rejected(String txHash, TxStatus status) {
        return new ConfirmationOutcome(Kind.REJECTED, txHash, null, null, null, status, status.getDetail());
    }

    public static ConfirmationOutcome indeterminate(String txHash, String detail) {
        return new ConfirmationOutcome(Kind.INDETERMINATE, txHash, null, null, null, null, detail);
    }

    public boolean isSuccess() {
        return kind == Kind.FINALIZED;
    }

    /**
     * 是否必须重新查询账本 (Whether the ledger must be re-queried before acting).
     */
    public boolean requiresRequery() {
        return kind == Kind.NO_MATCHING_EVENT || kind == Kind.INDETERMINATE;
    }
}
