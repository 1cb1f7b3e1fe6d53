package io.github.vevoly.petledger.api.exception;

/**
 * <h3>账本异常基类 (Base Ledger Exception)</h3>
 *
 * <p>所有由账本内部抛出的、可预期的异常都应继承此类。错误只作用于单个命令，不会使账本不可用。</p>
 *
 * <hr>
 * <span style="color: gray; font-size: 0.9em;">
 * <b>Base exception for the pet ledger.</b><br>
 * All predictable exceptions raised by the ledger extend this class.
 * Every error is scoped to a single command; the ledger stays usable afterwards.
 * </span>
 *
 * @author vevoly
 * @since 1.0.0
 */
public class PetLedgerException extends Exception {

    private final PetLedgerErrorCode errorCode;

    public PetLedgerException(PetLedgerErrorCode errorCode) {
        super(errorCode.getDefaultMessage());
        this.errorCode = errorCode;
    }

    public PetLedgerException(PetLedgerErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public PetLedgerException(PetLedgerErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public PetLedgerErrorCode getErrorCode() {
        return errorCode;
    }
}
