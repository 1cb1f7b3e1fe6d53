package io.github.vevoly.petledger.api.exception;

/**
 * <h3>账本错误码 (Ledger Error Codes)</h3>
 *
 * <p>定义了账本、节点与客户端可能抛出的所有标准异常代码。</p>
 *
 * <hr>
 * <span style="color: gray; font-size: 0.9em;">
 * <b>Ledger Error Codes.</b><br>
 * Defines all standard exception codes raised by the ledger, the node and the client.
 * </span>
 *
 * @author vevoly
 * @since 1.0.0
 */
public enum PetLedgerErrorCode {

    // --- 1xxx: 初始化与配置错误 (Initialization & Configuration) ---
    INITIALIZATION_FAILED(1001, "Ledger initialization failed"),

    // --- 2xxx: 调度与运行时错误 (Dispatch & Runtime) ---
    ACCOUNT_ALREADY_HAS_PET(2001, "Account already has a pet"),
    ACCOUNT_HAS_NO_PET(2002, "Account has no pet"),
    DUPLICATE_TRANSACTION(2003, "Transaction already imported"),
    UNKNOWN_BLOCK(2004, "Block is unknown to this node"),

    // --- 3xxx: 持久化错误 (Persistence) ---
    SNAPSHOT_SAVE_FAILED(3002, "Failed to save snapshot"),
    SNAPSHOT_LOAD_FAILED(3003, "Failed to load snapshot"),

    // --- 4xxx: API 调用错误 (API Usage) ---
    INVALID_ARGUMENT(4001, "Invalid argument provided"),
    PET_NAME_TOO_LONG(4002, "Pet name exceeds the configured length bound"),
    INVALID_SIGNATURE(4003, "Envelope signature does not verify"),

    ;

    private final int code;
    private final String defaultMessage;

    PetLedgerErrorCode(int code, String defaultMessage) {
        this.code = code;
        this.defaultMessage = defaultMessage;
    }

    public int getCode() {
        return code;
    }

    public String getDefaultMessage() {
        return defaultMessage;
    }
}
