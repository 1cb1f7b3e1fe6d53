package io.github.vevoly.petledger.core.store;

import io.github.vevoly.petledger.api.LedgerStore;
import io.github.vevoly.petledger.api.constants.PetLedgerConstant;
import io.github.vevoly.petledger.api.model.AccountId;
import io.github.vevoly.petledger.api.model.PetRecord;

import java.util.Optional;
import java.util.OptionalLong;

/**
 * <h3>内存账本存储 (In-Memory Ledger Store)</h3>
 *
 * <p>
 * {@link LedgerStore} 的默认实现，数据保存在 {@link PetLedgerState} 中。
 * 每个实例相互独立，多个账本可以在同一进程（例如测试）中共存。
 * </p>
 *
 * <hr>
 *
 * <span style="color: gray; font-size: 0.9em;">
 * <b>In-Memory Ledger Store.</b><br>
 * Default {@link LedgerStore} backed by a {@link PetLedgerState}.
 * Instances are independent, so several ledgers can coexist in one process (e.g. in tests).
 * </span>
 *
 * @author vevoly
 * @since 1.0.0
 */
public class InMemoryLedgerStore implements LedgerStore {

    private volatile PetLedgerState state;

    public InMemoryLedgerStore() {
        this(new PetLedgerState());
    }

    public InMemoryLedgerStore(PetLedgerState state) {
        this.state = state;
    }

    /**
     * 当前状态 (Current state), 用于快照 / used for snapshots.
     */
    public PetLedgerState getState() {
        return state;
    }

    /**
     * 替换为快照中恢复的状态 (Replace with a state restored from a snapshot).
     */
    public void load(PetLedgerState restored) {
        if (restored == null) {
            throw new IllegalArgumentException("Restored state must not be null");
        }
        this.state = restored;
    }

    @Override
    public Optional<PetRecord> get(AccountId account) {
        return Optional.ofNullable(state.getOwners().get(account));
    }

    @Override
    public void put(AccountId account, PetRecord record) {
        state.getOwners().put(account, record);
    }

    @Override
    public void remove(AccountId account) {
        state.getOwners().remove(account);
    }

    @Override
    public long feedTimeOf(long petId) {
        return state.getFeedTimes().getOrDefault(petId, PetLedgerConstant.NEVER_FED);
    }

    @Override
    public void setFeedTime(long petId, long height) {
        state.getFeedTimes().put(petId, height);
    }

    @Override
    public OptionalLong sleepTimeOf(long petId) {
        Long height = state.getSleepTimes().get(petId);
        return height == null ? OptionalLong.empty() : OptionalLong.of(height);
    }

    @Override
    public void setSleepTime(long petId, long height) {
        state.getSleepTimes().put(petId, height);
    }

    @Override
    public int size() {
        return state.getOwners().size();
    }
}
