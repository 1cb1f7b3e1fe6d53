package io.github.vevoly.petledger.api.event;

import lombok.Value;

import java.io.Serial;
import java.io.Serializable;

/**
 * <h3>事件日志条目 (Event Log Entry)</h3>
 *
 * <p>
 * 事件及其上下文：全局序号、所在区块高度、区块内交易序号、交易哈希。
 * 直接通过账本门面执行（不经节点）的命令没有交易哈希，{@code txHash} 为 null，{@code txIndex} 为 -1。
 * </p>
 *
 * <hr>
 *
 * <span style="color: gray; font-size: 0.9em;">
 * <b>Event Log Entry.</b><br>
 * An event with its context: global sequence, block height, index of the transaction in the block and its hash.
 * Commands applied directly through the ledger facade carry no hash ({@code null}) and index -1.
 * </span>
 *
 * @author vevoly
 * @since 1.0.0
 */
@Value
public class EventRecord implements Serializable {
    @Serial
    private static final long serialVersionUID = 1L;

    long sequence;
    long height;
    int txIndex;
    String txHash;
    PetEvent event;

    /**
     * 是否由指定交易产生 (Whether produced by the given transaction).
     */
    public boolean isFrom(String hash) {
        return txHash != null && txHash.equals(hash);
    }
}
