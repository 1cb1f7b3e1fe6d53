package io.github.vevoly.petledger.api.event;

import io.github.vevoly.petledger.api.model.AccountId;
import lombok.Value;

import java.io.Serial;

/**
 * 宠物已铸造 (A new pet is minted). [owner, petId]
 *
 * @author vevoly
 * @since 1.0.0
 */
@Value
public class PetMinted implements PetEvent {
    @Serial
    private static final long serialVersionUID = 1L;

    AccountId owner;
    long petId;

    @Override
    public EventType getType() {
        return EventType.PET_MINTED;
    }
}
