package io.github.vevoly.petledger.api.crypto;

import io.github.vevoly.petledger.api.model.AccountId;

/**
 * <h3>签名器接口 (Signer)</h3>
 *
 * <p>持有账户私钥，为命令载荷签名。提交客户端用它把命令打包成签名信封。</p>
 *
 * <hr>
 * <span style="color: gray; font-size: 0.9em;">
 * <b>Signer.</b> Holds an account's private key and signs command payloads for the submission client.
 * </span>
 *
 * @author vevoly
 * @since 1.0.0
 */
public interface Signer {

    /**
     * 签名者账户 (The signing account).
     */
    AccountId getAccount();

    /**
     * 对载荷签名 (Sign the payload).
     *
     * @param payload 规范编码后的命令 (Canonical command encoding)
     * @return 签名 (Signature bytes)
     */
    byte[] sign(byte[] payload);
}
