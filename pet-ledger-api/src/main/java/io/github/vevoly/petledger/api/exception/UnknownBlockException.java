package io.github.vevoly.petledger.api.exception;

import io.github.vevoly.petledger.api.tx.BlockRef;

/**
 * <h3>未知区块异常</h3>
 *
 * <p>请求的区块引用不存在于当前节点，或哈希与该高度的区块不一致。</p>
 *
 * <hr>
 * <span style="color: gray; font-size: 0.9em;">
 * <b>Unknown block.</b><br>
 * The requested block ref is not known to this node, or its hash does not match the block at that height.
 * </span>
 *
 * @author vevoly
 * @since 1.0.0
 */
public class UnknownBlockException extends PetLedgerException {
    public UnknownBlockException(BlockRef block) {
        super(PetLedgerErrorCode.UNKNOWN_BLOCK, PetLedgerErrorCode.UNKNOWN_BLOCK.getDefaultMessage() + ": " + block);
    }
}
