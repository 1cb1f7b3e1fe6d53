package io.github.vevoly.petledger.api.command;

import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.io.Serial;

/**
 * 睡眠命令，无参数 (Put the sender's pet to sleep; no arguments).
 *
 * @author vevoly
 * @since 1.0.0
 */
@ToString
@EqualsAndHashCode
public final class SleepCommand implements PetCommand {
    @Serial
    private static final long serialVersionUID = 1L;

    static final SleepCommand INSTANCE = new SleepCommand();

    private SleepCommand() {
    }

    @Override
    public CommandType getType() {
        return CommandType.SLEEP;
    }

    @Serial
    private Object readResolve() {
        return INSTANCE;
    }
}
