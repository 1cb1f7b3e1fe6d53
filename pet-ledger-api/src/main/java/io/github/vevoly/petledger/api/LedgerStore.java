package io.github.vevoly.petledger.api;

import io.github.vevoly.petledger.api.model.AccountId;
import io.github.vevoly.petledger.api.model.PetRecord;

import java.util.Optional;
import java.util.OptionalLong;

/**
 * <h3>账本存储接口 (Ledger Store)</h3>
 *
 * <p>
 * 权威的 账户 → 宠物记录 映射，以及 宠物 ID → 活动时间戳 映射。
 * 纯数据访问，<b>不做任何校验</b>；所有不变量由调度器在写入前保证。
 * </p>
 *
 * <hr>
 *
 * <span style="color: gray; font-size: 0.9em;">
 * <b>Ledger Store.</b><br>
 * The authoritative account → pet record mapping and pet id → activity timestamps.
 * Pure data access with <b>no validation</b>; invariants are enforced by the dispatcher before writing.
 * </span>
 *
 * @author vevoly
 * @since 1.0.0
 */
public interface LedgerStore {

    /**
     * 查询账户持有的宠物 (Pet owned by the account).
     */
    Optional<PetRecord> get(AccountId account);

    /**
     * 写入账户的宠物 (Store the pet under the account). 记录中已包含 id / the record carries its id.
     */
    void put(AccountId account, PetRecord record);

    /**
     * 移除账户的宠物 (Remove the account's entry).
     */
    void remove(AccountId account);

    /**
     * 最近喂食高度，从未喂食时返回哨兵值 0 (Last feed height, sentinel 0 when never fed).
     */
    long feedTimeOf(long petId);

    void setFeedTime(long petId, long height);

    /**
     * 最近睡眠高度，从未睡眠时为空 (Last sleep height, empty when never slept).
     * <p>存在与否本身有意义：区分“从未睡眠”和“在高度 0 睡眠”。</p>
     */
    OptionalLong sleepTimeOf(long petId);

    void setSleepTime(long petId, long height);

    /**
     * 持有宠物的账户数 (Number of owning accounts).
     */
    int size();
}
