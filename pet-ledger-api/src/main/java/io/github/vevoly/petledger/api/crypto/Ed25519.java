package io.github.vevoly.petledger.api.crypto;

import com.google.common.io.BaseEncoding;
import io.github.vevoly.petledger.api.model.AccountId;
import lombok.extern.slf4j.Slf4j;

import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.PublicKey;
import java.security.Signature;
import java.security.spec.X509EncodedKeySpec;
import java.util.Arrays;

/**
 * <h3>Ed25519 签名工具 (Ed25519 Support)</h3>
 *
 * <p>
 * 基于 JDK 自带的 Ed25519 实现。账户地址为 32 字节原始公钥的小写十六进制，
 * 校验时补上固定的 X.509 前缀还原公钥。
 * </p>
 *
 * <hr>
 *
 * <span style="color: gray; font-size: 0.9em;">
 * <b>Ed25519 Support.</b><br>
 * Built on the JDK's Ed25519 provider. An account address is the lower-case hex of the raw 32-byte public key;
 * verification restores the key by prepending the fixed X.509 prefix.
 * </span>
 *
 * @author vevoly
 * @since 1.0.0
 */
@Slf4j
public final class Ed25519 {

    public static final String ALGORITHM = "Ed25519";

    private static final BaseEncoding HEX = BaseEncoding.base16().lowerCase();

    // SubjectPublicKeyInfo 头部 (OID 1.3.101.112) / SubjectPublicKeyInfo header for Ed25519
    private static final byte[] X509_PREFIX = HEX.decode("302a300506032b6570032100");
    private static final int RAW_KEY_LENGTH = 32;

    private Ed25519() {
    }

    /**
     * 生成新的签名器 (Generate a signer with a fresh key pair).
     */
    public static Signer generateSigner() {
        try {
            KeyPair keyPair = KeyPairGenerator.getInstance(ALGORITHM).generateKeyPair();
            return new KeyPairSigner(keyPair);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Ed25519 is not available in this JVM", e);
        }
    }

    /**
     * 使用已有密钥对创建签名器 (Create a signer from an existing key pair).
     */
    public static Signer signer(KeyPair keyPair) {
        return new KeyPairSigner(keyPair);
    }

    /**
     * 从公钥推导账户 (Derive the account from a public key).
     */
    public static AccountId accountOf(PublicKey publicKey) {
        byte[] encoded = publicKey.getEncoded();
        byte[] raw = Arrays.copyOfRange(encoded, encoded.length - RAW_KEY_LENGTH, encoded.length);
        return AccountId.of(HEX.encode(raw));
    }

    /**
     * 默认校验器 (Default verifier). 地址不是合法公钥时返回 false / false when the address is not a key.
     */
    public static SignatureVerifier verifier() {
        return Ed25519::verify;
    }

    static boolean verify(AccountId account, byte[] payload, byte[] signature) {
        if (signature == null || signature.length == 0) {
            return false;
        }
        try {
            Signature verifier = Signature.getInstance(ALGORITHM);
            verifier.initVerify(publicKeyOf(account));
            verifier.update(payload);
            return verifier.verify(signature);
        } catch (GeneralSecurityException | IllegalArgumentException e) {
            log.debug("Signature of account {} rejected: {}", account, e.getMessage());
            return false;
        }
    }

    private static PublicKey publicKeyOf(AccountId account) throws GeneralSecurityException {
        byte[] raw = HEX.decode(account.getAddress());
        if (raw.length != RAW_KEY_LENGTH) {
            throw new IllegalArgumentException("Address is not a 32-byte Ed25519 key");
        }
        byte[] encoded = new byte[X509_PREFIX.length + RAW_KEY_LENGTH];
        System.arraycopy(X509_PREFIX, 0, encoded, 0, X509_PREFIX.length);
        System.arraycopy(raw, 0, encoded, X509_PREFIX.length, RAW_KEY_LENGTH);
        return KeyFactory.getInstance(ALGORITHM).generatePublic(new X509EncodedKeySpec(encoded));
    }

    private static final class KeyPairSigner implements Signer {

        private final KeyPair keyPair;
        private final AccountId account;

        private KeyPairSigner(KeyPair keyPair) {
            this.keyPair = keyPair;
            this.account = accountOf(keyPair.getPublic());
        }

        @Override
        public AccountId getAccount() {
            return account;
        }

        @Override
        public byte[] sign(byte[] payload) {
            try {
                Signature signature = Signature.getInstance(ALGORITHM);
                signature.initSign(keyPair.getPrivate());
                signature.update(payload);
                return signature.sign();
            } catch (GeneralSecurityException e) {
                throw new IllegalStateException("Failed to sign payload for " + account, e);
            }
        }
    }
}
