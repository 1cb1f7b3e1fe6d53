package io.github.vevoly.petledger.api.tx;

import io.github.vevoly.petledger.api.command.PetCommand;
import io.github.vevoly.petledger.api.model.AccountId;
import lombok.Value;

/**
 * <h3>签名命令信封 (Signed Command Envelope)</h3>
 *
 * <p>
 * {@code payload} 是 {@code CommandCodec} 产生的规范编码，签名覆盖整个载荷；
 * {@code txHash} 为载荷的 SHA-256 十六进制，用于去重与状态跟踪。
 * </p>
 *
 * <hr>
 *
 * <span style="color: gray; font-size: 0.9em;">
 * <b>Signed Command Envelope.</b><br>
 * {@code payload} is the canonical encoding produced by {@code CommandCodec}; the signature covers it entirely.
 * {@code txHash} is the hex SHA-256 of the payload, used for deduplication and status tracking.
 * </span>
 *
 * @author vevoly
 * @since 1.0.0
 */
@Value
public class SignedCommand {

    AccountId signer;
    String txId;
    PetCommand command;
    byte[] payload;
    byte[] signature;
    String txHash;

    public SignedCommand(AccountId signer, String txId, PetCommand command, byte[] payload, byte[] signature, String txHash) {
        this.signer = signer;
        this.txId = txId;
        this.command = command;
        this.payload = payload == null ? null : payload.clone();
        this.signature = signature == null ? null : signature.clone();
        this.txHash = txHash;
    }

    /**
     * 载荷副本 (Copy of the payload); 信封封装后不可修改 / the envelope is immutable once sealed.
     */
    public byte[] getPayload() {
        return payload == null ? null : payload.clone();
    }

    /**
     * 签名副本 (Copy of the signature).
     */
    public byte[] getSignature() {
        return signature == null ? null : signature.clone();
    }
}
