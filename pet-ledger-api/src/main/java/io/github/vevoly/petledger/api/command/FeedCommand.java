package io.github.vevoly.petledger.api.command;

import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.io.Serial;

/**
 * 喂食命令，无参数 (Feed the sender's pet; no arguments).
 *
 * @author vevoly
 * @since 1.0.0
 */
@ToString
@EqualsAndHashCode
public final class FeedCommand implements PetCommand {
    @Serial
    private static final long serialVersionUID = 1L;

    static final FeedCommand INSTANCE = new FeedCommand();

    private FeedCommand() {
    }

    @Override
    public CommandType getType() {
        return CommandType.FEED;
    }

    @Serial
    private Object readResolve() {
        return INSTANCE;
    }
}
