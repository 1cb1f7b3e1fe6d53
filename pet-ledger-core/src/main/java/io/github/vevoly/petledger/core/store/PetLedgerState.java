package io.github.vevoly.petledger.core.store;

import io.github.vevoly.petledger.api.model.AccountId;
import io.github.vevoly.petledger.api.model.PetRecord;
import lombok.Getter;

import java.io.Serial;
import java.io.Serializable;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * <h3>账本内存状态 (Ledger Memory State)</h3>
 *
 * <p>
 * 持有所有权索引与两张活动时间表，是快照的序列化单元。
 * 必须保留无参构造函数，供 Kryo 反序列化使用。
 * </p>
 *
 * <hr>
 *
 * <span style="color: gray; font-size: 0.9em;">
 * <b>Ledger Memory State.</b><br>
 * Holds the ownership index and both activity tables; this is the unit written into snapshots.
 * Keeps a no-arg constructor for Kryo.
 * </span>
 *
 * @author vevoly
 * @since 1.0.0
 */
@Getter
public class PetLedgerState implements Serializable {
    @Serial
    private static final long serialVersionUID = 1L;

    /**
     * 所有权索引 (Ownership index): account → pet.
     */
    private final Map<AccountId, PetRecord> owners = new ConcurrentHashMap<>();

    /**
     * 最近喂食高度 (Last feed height): pet id → height.
     */
    private final Map<Long, Long> feedTimes = new ConcurrentHashMap<>();

    /**
     * 最近睡眠高度 (Last sleep height): pet id → height.
     */
    private final Map<Long, Long> sleepTimes = new ConcurrentHashMap<>();
}
