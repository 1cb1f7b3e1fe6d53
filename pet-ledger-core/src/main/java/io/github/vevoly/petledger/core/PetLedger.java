package io.github.vevoly.petledger.core;

import com.google.common.util.concurrent.Striped;
import io.github.vevoly.petledger.api.CommandDispatcher;
import io.github.vevoly.petledger.api.LedgerClock;
import io.github.vevoly.petledger.api.LedgerStore;
import io.github.vevoly.petledger.api.command.MintCommand;
import io.github.vevoly.petledger.api.command.PetCommand;
import io.github.vevoly.petledger.api.command.TransferCommand;
import io.github.vevoly.petledger.api.constants.PetLedgerConstant;
import io.github.vevoly.petledger.api.event.EventRecord;
import io.github.vevoly.petledger.api.event.PetEvent;
import io.github.vevoly.petledger.api.exception.PetLedgerException;
import io.github.vevoly.petledger.api.model.AccountId;
import io.github.vevoly.petledger.api.model.PetRecord;
import io.github.vevoly.petledger.core.clock.BlockHeightClock;
import io.github.vevoly.petledger.core.dispatch.PetCommandDispatcher;
import io.github.vevoly.petledger.core.event.EventLog;
import io.github.vevoly.petledger.core.store.InMemoryLedgerStore;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.locks.Lock;

/**
 * <h3>宠物账本 (Pet Ledger)</h3>
 *
 * <p>
 * 把存储、调度器、时钟与事件日志组合成同步入口。一次 {@link #apply} 要么写入全部变更并追加恰好一个事件，
 * 要么抛出类型化错误且不留下任何痕迹。
 * </p>
 *
 * <h3>并发模型 (Concurrency):</h3>
 * <p>
 * 允许多个线程并行调用，互斥粒度是账户与宠物 ID：命令先锁住发送者（转移命令同时锁住接收者），
 * 再锁住发送者当前宠物的 ID（铸造时为新宠物的 ID）。不同账户可以持有相同 ID 的宠物，
 * 它们的喂食、睡眠时间写入同一条目，因此必须按 ID 互斥。
 * 锁来自 Guava {@link Striped}，{@code bulkGet} 按条带顺序返回，多把锁按同一顺序获取；
 * 宠物锁来自独立的条带集合，且总在账户锁之后获取，不会死锁。
 * 由 {@code PetLedgerNode} 驱动时只有一个调度线程，锁不会产生竞争。
 * </p>
 *
 * <hr>
 *
 * <span style="color: gray; font-size: 0.9em;">
 * <b>Pet Ledger.</b><br>
 * Synchronous entry point over store, dispatcher, clock and event log. One {@link #apply} either writes every
 * mutation and appends exactly one event, or throws a typed error and leaves no trace.<br>
 * <b>Concurrency:</b> callers may run in parallel; mutual exclusion is per account (the sender, plus the receiver
 * of a transfer) and then per pet id, since two accounts may hold pets with the same id and share its feed and
 * sleep entries. Account locks are Guava {@link Striped} locks acquired in stripe order; the pet lock comes from
 * a separate stripe set and is always taken last.
 * </span>
 *
 * @author vevoly
 * @since 1.0.0
 */
@Slf4j
public class PetLedger {

    /**
     * 直接调用 (不经过区块) 时事件的交易序号.
     * <br><span style="color: gray;">Tx index recorded for events applied directly, outside a block.</span>
     */
    public static final int NO_TX_INDEX = -1;

    @Getter
    private final LedgerStore store;
    private final CommandDispatcher dispatcher;
    @Getter
    private final LedgerClock clock;
    @Getter
    private final EventLog eventLog;
    private final Striped<Lock> accountLocks;
    private final Striped<Lock> petLocks;

    /**
     * 使用默认组件创建独立账本 (Standalone ledger with default components).
     */
    public PetLedger() {
        this(new InMemoryLedgerStore(), new PetCommandDispatcher(), new BlockHeightClock(), new EventLog(),
                PetLedgerConstant.DEFAULT_LOCK_STRIPES);
    }

    public PetLedger(LedgerStore store, CommandDispatcher dispatcher, LedgerClock clock, EventLog eventLog, int lockStripes) {
        if (lockStripes <= 0) {
            throw new IllegalArgumentException("Lock stripes must be greater than 0");
        }
        this.store = store;
        this.dispatcher = dispatcher;
        this.clock = clock;
        this.eventLog = eventLog;
        this.accountLocks = Striped.lock(lockStripes);
        this.petLocks = Striped.lock(lockStripes);
    }

    /**
     * 在当前高度执行命令 (Apply a command at the current height).
     *
     * @param sender  发送者 (Sender)
     * @param command 命令 (Command)
     * @return 追加到事件日志中的记录 (The record appended to the event log)
     * @throws PetLedgerException 前置条件不满足，存储未改变 / precondition failed, store unchanged
     */
    public EventRecord apply(AccountId sender, PetCommand command) throws PetLedgerException {
        return apply(sender, command, NO_TX_INDEX, null);
    }

    /**
     * 执行区块内的交易 (Apply a transaction inside a block).
     *
     * @param txIndex 区块内序号 (Index within the block)
     * @param txHash  交易哈希 (Tx hash)
     */
    public EventRecord apply(AccountId sender, PetCommand command, int txIndex, String txHash) throws PetLedgerException {
        List<Lock> locks = lockAccounts(sender, command);
        try {
            lockPet(sender, command, locks);
            long height = clock.currentHeight();
            PetEvent event = dispatcher.dispatch(store, sender, command, height);
            EventRecord record = eventLog.append(height, txIndex, txHash, event);
            if (log.isDebugEnabled()) {
                log.debug("Applied {} from {} at #{}: {}", command.getType(), sender, height, event);
            }
            return record;
        } finally {
            unlockAll(locks);
        }
    }

    public Optional<PetRecord> petOf(AccountId account) {
        return store.get(account);
    }

    public long lastFeedTime(long petId) {
        return store.feedTimeOf(petId);
    }

    public OptionalLong lastSleepTime(long petId) {
        return store.sleepTimeOf(petId);
    }

    public int ownerCount() {
        return store.size();
    }

    private List<Lock> lockAccounts(AccountId sender, PetCommand command) {
        List<String> keys = new ArrayList<>(2);
        keys.add(sender.getAddress());
        if (command instanceof TransferCommand) {
            keys.add(((TransferCommand) command).getReceiver().getAddress());
        }
        List<Lock> locks = new ArrayList<>();
        for (Lock lock : accountLocks.bulkGet(keys)) {
            // 同一条带只锁一次 / a stripe shared by both keys is locked once
            if (!locks.contains(lock)) {
                lock.lock();
                locks.add(lock);
            }
        }
        return locks;
    }

    /**
     * 在账户锁内解析宠物 ID 并加锁。发送者的记录已被账户锁保护，解析结果在本次调用内不会变化。
     * 没有宠物的发送者不写任何 ID 条目，无需加锁。
     */
    private void lockPet(AccountId sender, PetCommand command, List<Lock> locks) {
        OptionalLong petId = command instanceof MintCommand
                ? OptionalLong.of(((MintCommand) command).getPetId())
                : store.get(sender).map(record -> OptionalLong.of(record.getId())).orElse(OptionalLong.empty());
        if (petId.isPresent()) {
            Lock lock = petLocks.get(petId.getAsLong());
            lock.lock();
            locks.add(lock);
        }
    }

    private static void unlockAll(List<Lock> locks) {
        for (int i = locks.size() - 1; i >= 0; i--) {
            locks.get(i).unlock();
        }
    }
}
