package io.github.vevoly.petledger.api.tx;

import io.github.vevoly.petledger.api.exception.PetLedgerErrorCode;
import lombok.Value;

import java.io.Serializable;
import java.io.Serial;

/**
 * <h3>交易回执 (Transaction Receipt)</h3>
 *
 * <p>
 * 每笔被打包的交易都有一条回执，调度失败的交易同样会被打包，失败的错误码内嵌在回执中。
 * </p>
 *
 * <hr>
 * <span style="color: gray; font-size: 0.9em;">
 * <b>Transaction Receipt.</b><br>
 * One per included transaction. Failed dispatches are included too, with the ledger error embedded.
 * </span>
 *
 * @author vevoly
 * @since 1.0.0
 */
@Value
public class TxReceipt implements Serializable {
    @Serial
    private static final long serialVersionUID = 1L;

    String txHash;
    int txIndex;
    long height;
    boolean success;
    PetLedgerErrorCode error;

    public static TxReceipt success(String txHash, int txIndex, long height) {
        return new TxReceipt(txHash, txIndex, height, true, null);
    }

    public static TxReceipt failure(String txHash, int txIndex, long height, PetLedgerErrorCode error) {
        return new TxReceipt(txHash, txIndex, height, false, error);
    }
}
