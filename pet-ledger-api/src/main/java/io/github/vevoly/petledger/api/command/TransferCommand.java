package io.github.vevoly.petledger.api.command;

import io.github.vevoly.petledger.api.model.AccountId;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.io.Serial;

/**
 * 转移命令 (Move the sender's pet to the receiver).
 *
 * @author vevoly
 * @since 1.0.0
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class TransferCommand implements PetCommand {
    @Serial
    private static final long serialVersionUID = 1L;

    AccountId receiver;

    public static TransferCommand of(AccountId receiver) {
        if (receiver == null) {
            throw new IllegalArgumentException("Receiver must not be null");
        }
        return new TransferCommand(receiver);
    }

    @Override
    public CommandType getType() {
        return CommandType.TRANSFER;
    }
}
