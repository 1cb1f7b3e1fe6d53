package io.github.vevoly.petledger.api.command;

import io.github.vevoly.petledger.api.event.EventType;

/**
 * <h3>命令类型 (Command Type)</h3>
 *
 * <p>
 * 封闭的命令集合。每种命令成功后恰好产生一种事件，确认监听器据此在区块事件中查找结果。
 * 编码值写入签名载荷，不可调整。
 * </p>
 *
 * <hr>
 *
 * <span style="color: gray; font-size: 0.9em;">
 * <b>Command Type.</b><br>
 * Closed set of commands. Each successful command yields exactly one event kind,
 * which the confirmation watcher looks for in the finalized block.
 * Wire codes are part of the signed payload and must never change.
 * </span>
 *
 * @author vevoly
 * @since 1.0.0
 */
public enum CommandType {

    MINT((byte) 0, EventType.PET_MINTED),
    TRANSFER((byte) 1, EventType.PET_TRANSFERRED),
    FEED((byte) 2, EventType.PET_FED),
    SLEEP((byte) 3, EventType.PET_SLEPT);

    private final byte code;
    private final EventType expectedEvent;

    CommandType(byte code, EventType expectedEvent) {
        this.code = code;
        this.expectedEvent = expectedEvent;
    }

    public byte getCode() {
        return code;
    }

    /**
     * 成功执行后应产生的事件类型 (Event produced on success).
     */
    public EventType getExpectedEvent() {
        return expectedEvent;
    }
}
