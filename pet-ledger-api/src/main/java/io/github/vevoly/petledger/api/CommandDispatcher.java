package io.github.vevoly.petledger.api;

import io.github.vevoly.petledger.api.command.PetCommand;
import io.github.vevoly.petledger.api.event.PetEvent;
import io.github.vevoly.petledger.api.exception.PetLedgerException;
import io.github.vevoly.petledger.api.model.AccountId;

/**
 * <h3>命令调度器接口 (Command Dispatcher)</h3>
 *
 * <p>
 * 每种命令对应一个状态转移。要么所有写入都生效并恰好返回一个事件，要么不做任何写入并抛出类型化错误。
 * </p>
 *
 * <p style="color: red">
 * <b>⚠️ 约束：</b> 实现中禁止 IO、锁与阻塞操作，并发控制由调用方负责。
 * </p>
 *
 * <hr>
 *
 * <span style="color: gray; font-size: 0.9em;">
 * <b>Command Dispatcher.</b><br>
 * One state transition per command kind. Either every store mutation applies and exactly one event is returned,
 * or nothing is written and a typed error is thrown.<br>
 * <b>⚠️</b> No IO, locks or blocking inside; concurrency control belongs to the caller.
 * </span>
 *
 * @author vevoly
 * @since 1.0.0
 */
@FunctionalInterface
public interface CommandDispatcher {

    /**
     * 执行命令 (Dispatch a command).
     *
     * @param store   账本存储 (Ledger store)
     * @param sender  已由传输层解析的发送者 (Sender resolved by the transport)
     * @param command 命令 (Command)
     * @param height  当前区块高度 (Current block height)
     * @return 成功事件 (The success event)
     * @throws PetLedgerException 前置条件不满足 / a precondition is not met
     */
    PetEvent dispatch(LedgerStore store, AccountId sender, PetCommand command, long height) throws PetLedgerException;
}
