package io.github.vevoly.petledger.api.event;

import io.github.vevoly.petledger.api.model.AccountId;

import java.io.Serializable;

/**
 * <h3>领域事件接口 (Domain Event)</h3>
 *
 * <p>
 * 每次成功调度恰好产生一个事件，按调度顺序追加到事件日志中。
 * 实现类只有四种：{@link PetMinted}、{@link PetTransferred}、{@link PetFed}、{@link PetSlept}。
 * </p>
 *
 * <hr>
 *
 * <span style="color: gray; font-size: 0.9em;">
 * <b>Domain Event.</b><br>
 * Exactly one event per successful dispatch, appended to the event log in dispatch order.
 * </span>
 *
 * @author vevoly
 * @since 1.0.0
 */
public interface PetEvent extends Serializable {

    EventType getType();

    /**
     * 事件涉及的宠物 ID (Pet id the event refers to).
     */
    long getPetId();

    /**
     * 事件发生后的持有者 (Owner after the event). 转移事件返回接收方 / the receiver for transfers.
     */
    AccountId getOwner();
}
