package io.github.vevoly.petledger.api.exception;

/**
 * <h3>初始化异常</h3>
 *
 * <p>当 Builder 参数校验失败或必要组件无法创建时抛出。</p>
 *
 * <hr>
 * <span style="color: gray; font-size: 0.9em;">
 * <b>Initialization exception.</b><br>
 * Thrown when a Builder's parameter validation fails or a required component cannot be created.
 * </span>
 *
 * @author vevoly
 * @since 1.0.0
 */
public class InitializationException extends PetLedgerException {
    public InitializationException(String message) {
        super(PetLedgerErrorCode.INITIALIZATION_FAILED, message);
    }
    public InitializationException(String message, Throwable cause) {
        super(PetLedgerErrorCode.INITIALIZATION_FAILED, message, cause);
    }
}
