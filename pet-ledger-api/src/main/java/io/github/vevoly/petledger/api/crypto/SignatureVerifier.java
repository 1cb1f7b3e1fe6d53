package io.github.vevoly.petledger.api.crypto;

import io.github.vevoly.petledger.api.model.AccountId;

/**
 * 签名校验接口 (Signature verifier), 由节点在准入阶段调用 / called by the node at admission.
 *
 * @author vevoly
 * @since 1.0.0
 */
@FunctionalInterface
public interface SignatureVerifier {

    /**
     * @return true 表示签名属于该账户 / true when the signature belongs to the account
     */
    boolean verify(AccountId account, byte[] payload, byte[] signature);
}
