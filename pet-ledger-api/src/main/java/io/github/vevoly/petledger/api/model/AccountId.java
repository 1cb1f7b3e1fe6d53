package io.github.vevoly.petledger.api.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.NoArgsConstructor;
import lombok.Value;

import java.io.Serial;
import java.io.Serializable;

/**
 * <h3>账户标识 (Account Identifier)</h3>
 *
 * <p>
 * 不透明的可比较键。账本不关心地址的具体格式，只要求非空。
 * 由 Ed25519 签名器生成的账户使用 32 字节公钥的小写十六进制作为地址。
 * </p>
 *
 * <hr>
 *
 * <span style="color: gray; font-size: 0.9em;">
 * <b>Account Identifier.</b><br>
 * An opaque, comparable key. The ledger only requires a non-blank address.
 * Accounts created by the Ed25519 signer use the lower-case hex of the raw 32-byte public key.
 * </span>
 *
 * @author vevoly
 * @since 1.0.0
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@NoArgsConstructor(force = true, access = AccessLevel.PRIVATE)
public class AccountId implements Comparable<AccountId>, Serializable {
    @Serial
    private static final long serialVersionUID = 1L;

    String address;

    /**
     * 由地址创建账户标识 (Create from address).
     *
     * @param address 账户地址 (Account address), 不能为空白 / must not be blank
     * @return 账户标识 (Account id)
     */
    public static AccountId of(String address) {
        if (address == null || address.isBlank()) {
            throw new IllegalArgumentException("Account address must not be blank");
        }
        return new AccountId(address);
    }

    @Override
    public int compareTo(AccountId other) {
        return address.compareTo(other.address);
    }

    @Override
    public String toString() {
        return address;
    }
}
