package io.github.vevoly.petledger.client;

import io.github.vevoly.petledger.api.command.PetCommand;
import io.github.vevoly.petledger.api.event.EventType;
import io.github.vevoly.petledger.api.model.AccountId;
import io.github.vevoly.petledger.api.tx.TxStatusStream;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * <h3>已提交交易 (Submitted Transaction)</h3>
 *
 * <p>
 * 一次提交的句柄：交易哈希、签名者、命令，以及只能消费一次的状态流。
 * 重试需要重新提交，得到新的句柄。
 * </p>
 *
 * <hr>
 *
 * <span style="color: gray; font-size: 0.9em;">
 * <b>Submitted Transaction.</b><br>
 * Handle of one submission: tx hash, signer, command and its single-pass status stream.
 * A retry is a new submission with a new handle.
 * </span>
 *
 * @author vevoly
 * @since 1.0.0
 */
@Getter
@ToString(exclude = "statuses")
@AllArgsConstructor
public class SubmittedTx implements AutoCloseable {

    private final String txHash;
    private final AccountId signer;
    private final PetCommand command;
    private final TxStatusStream statuses;

    /**
     * 成功时应出现的事件类型 (Event type expected on success).
     */
    public EventType getExpectedEvent() {
        return command.getType().getExpectedEvent();
    }

    /**
     * 停止观察 (Stop observing). 不会撤销账本上已发生的变更 / never undoes a ledger effect.
     */
    @Override
    public void close() {
        statuses.close();
    }
}
