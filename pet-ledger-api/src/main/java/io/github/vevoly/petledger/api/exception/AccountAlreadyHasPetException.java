package io.github.vevoly.petledger.api.exception;

import io.github.vevoly.petledger.api.model.AccountId;

/**
 * <h3>账户已持有宠物</h3>
 *
 * <p>校验失败发生在任何写入之前，账本状态不变。</p>
 *
 * <hr>
 * <span style="color: gray; font-size: 0.9em;">
 * <b>Account already has a pet.</b><br>
 * Raised by the dispatcher when a mint sender or a transfer receiver already owns a pet. Validation runs before any mutation; the ledger is unchanged.
 * </span>
 *
 * @author vevoly
 * @since 1.0.0
 */
public class AccountAlreadyHasPetException extends PetLedgerException {

    private final AccountId account;

    public AccountAlreadyHasPetException(AccountId account) {
        super(PetLedgerErrorCode.ACCOUNT_ALREADY_HAS_PET, PetLedgerErrorCode.ACCOUNT_ALREADY_HAS_PET.getDefaultMessage() + ": " + account);
        this.account = account;
    }

    /**
     * 触发校验失败的账户 (The account that failed the precondition).
     */
    public AccountId getAccount() {
        return account;
    }
}
