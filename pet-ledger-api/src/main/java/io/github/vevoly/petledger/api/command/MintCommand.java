package io.github.vevoly.petledger.api.command;

import io.github.vevoly.petledger.api.model.PetRecord;
import io.github.vevoly.petledger.api.model.Species;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.io.Serial;

/**
 * 铸造命令 (Mint a new pet for the sender).
 * <p>名称长度由编码层校验，调度器假定其已满足上限。</p>
 * <span style="color: gray;">The name bound is enforced by the codec; the dispatcher assumes it holds.</span>
 *
 * @author vevoly
 * @since 1.0.0
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class MintCommand implements PetCommand {
    @Serial
    private static final long serialVersionUID = 1L;

    String name;
    Species species;
    long petId;

    public static MintCommand of(String name, Species species, long petId) {
        if (name == null) {
            throw new IllegalArgumentException("Pet name must not be null");
        }
        if (species == null) {
            throw new IllegalArgumentException("Pet species must not be null");
        }
        return new MintCommand(name, species, PetRecord.requireValidId(petId));
    }

    @Override
    public CommandType getType() {
        return CommandType.MINT;
    }
}
