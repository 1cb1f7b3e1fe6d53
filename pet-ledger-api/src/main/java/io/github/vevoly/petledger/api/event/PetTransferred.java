package io.github.vevoly.petledger.api.event;

import io.github.vevoly.petledger.api.model.AccountId;
import lombok.Value;

import java.io.Serial;

/**
 * 宠物已转移 (Pet is transferred). [from, to, petId]
 *
 * @author vevoly
 * @since 1.0.0
 */
@Value
public class PetTransferred implements PetEvent {
    @Serial
    private static final long serialVersionUID = 1L;

    AccountId from;
    AccountId to;
    long petId;

    @Override
    public EventType getType() {
        return EventType.PET_TRANSFERRED;
    }

    @Override
    public AccountId getOwner() {
        return to;
    }
}
