package io.github.vevoly.petledger.api;

import io.github.vevoly.petledger.api.event.EventRecord;
import io.github.vevoly.petledger.api.exception.UnknownBlockException;
import io.github.vevoly.petledger.api.model.AccountId;
import io.github.vevoly.petledger.api.model.PetRecord;
import io.github.vevoly.petledger.api.tx.BlockRef;
import io.github.vevoly.petledger.api.tx.SignedCommand;
import io.github.vevoly.petledger.api.tx.TxReceipt;
import io.github.vevoly.petledger.api.tx.TxStatusStream;

import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * <h3>传输层接口 (Ledger Transport)</h3>
 *
 * <p>
 * 客户端与账本之间的边界：提交签名信封并返回状态流，按区块读取事件与回执，查询账本状态。
 * 提交永远不会抛出异常，所有拒绝都以终态出现在状态流中。
 * </p>
 *
 * <hr>
 *
 * <span style="color: gray; font-size: 0.9em;">
 * <b>Ledger Transport.</b><br>
 * Boundary between client and ledger: submit signed envelopes and observe their status stream,
 * read events and receipts per block, query ledger state.
 * Submission never throws; every rejection shows up as a terminal status on the stream.
 * </span>
 *
 * @author vevoly
 * @since 1.0.0
 */
public interface LedgerTransport {

    /**
     * 提交签名命令 (Submit a signed command).
     *
     * @return 该笔提交的状态流 (Status stream of this submission)
     */
    TxStatusStream submit(SignedCommand envelope);

    /**
     * 读取区块内的事件 (Events emitted in the block), 按调度顺序 / in dispatch order.
     */
    List<EventRecord> fetchEvents(BlockRef block) throws UnknownBlockException;

    /**
     * 读取交易回执 (Receipt of a transaction in the block).
     */
    Optional<TxReceipt> fetchReceipt(BlockRef block, String txHash) throws UnknownBlockException;

    Optional<PetRecord> petOf(AccountId account);

    long lastFeedTime(long petId);

    OptionalLong lastSleepTime(long petId);
}
