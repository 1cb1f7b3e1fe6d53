package io.github.vevoly.petledger.api.command;

import io.github.vevoly.petledger.api.model.AccountId;
import io.github.vevoly.petledger.api.model.Species;

import java.io.Serializable;

/**
 * <h3>账本命令接口 (Ledger Command)</h3>
 *
 * <p>
 * 所有状态变更命令的公共接口。命令本身不包含发送者，发送者由签名信封在传输层解析后传给调度器。
 * 实现类只有 {@link MintCommand}、{@link TransferCommand}、{@link FeedCommand}、{@link SleepCommand} 四种，
 * 调度器通过 {@link #getType()} 穷举分发。
 * </p>
 *
 * <hr>
 *
 * <span style="color: gray; font-size: 0.9em;">
 * <b>Ledger Command.</b><br>
 * Common interface of all state-changing commands. The sender is not part of the command:
 * it is resolved by the transport from the signed envelope and handed to the dispatcher.
 * Exactly four implementations exist; the dispatcher switches exhaustively on {@link #getType()}.
 * </span>
 *
 * @author vevoly
 * @since 1.0.0
 */
public interface PetCommand extends Serializable {

    /**
     * 命令类型 (Command type).
     *
     * @return 命令类型
     */
    CommandType getType();

    static MintCommand mint(String name, Species species, long petId) {
        return MintCommand.of(name, species, petId);
    }

    static TransferCommand transfer(AccountId receiver) {
        return TransferCommand.of(receiver);
    }

    static FeedCommand feed() {
        return FeedCommand.INSTANCE;
    }

    static SleepCommand sleep() {
        return SleepCommand.INSTANCE;
    }
}
