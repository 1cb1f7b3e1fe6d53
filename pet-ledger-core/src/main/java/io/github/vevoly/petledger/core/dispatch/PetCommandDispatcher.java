package io.github.vevoly.petledger.core.dispatch;

import io.github.vevoly.petledger.api.CommandDispatcher;
import io.github.vevoly.petledger.api.LedgerStore;
import io.github.vevoly.petledger.api.command.MintCommand;
import io.github.vevoly.petledger.api.command.PetCommand;
import io.github.vevoly.petledger.api.command.TransferCommand;
import io.github.vevoly.petledger.api.event.PetEvent;
import io.github.vevoly.petledger.api.event.PetFed;
import io.github.vevoly.petledger.api.event.PetMinted;
import io.github.vevoly.petledger.api.event.PetSlept;
import io.github.vevoly.petledger.api.event.PetTransferred;
import io.github.vevoly.petledger.api.exception.AccountAlreadyHasPetException;
import io.github.vevoly.petledger.api.exception.AccountHasNoPetException;
import io.github.vevoly.petledger.api.exception.PetLedgerException;
import io.github.vevoly.petledger.api.model.AccountId;
import io.github.vevoly.petledger.api.model.PetRecord;

/**
 * <h3>宠物命令调度器 (Pet Command Dispatcher)</h3>
 *
 * <p>
 * 每种命令一个状态转移，所有前置条件在写入之前检查完毕，因此失败时存储保持不变。
 * </p>
 * <ul>
 *     <li><b>MINT:</b> 发送者无宠物 → 创建记录，产生 PetMinted。不检查宠物 ID 的全局唯一性。</li>
 *     <li><b>TRANSFER:</b> 发送者有宠物且接收者无宠物 → 移动记录，产生 PetTransferred。转给自己视为接收者已有宠物。</li>
 *     <li><b>FEED / SLEEP:</b> 发送者有宠物 → 以当前高度记录时间，产生 PetFed / PetSlept。</li>
 * </ul>
 *
 * <hr>
 *
 * <span style="color: gray; font-size: 0.9em;">
 * <b>Pet Command Dispatcher.</b><br>
 * One transition per command kind. Every precondition is checked before the first write,
 * so a failed command leaves the store untouched.<br>
 * Pet id uniqueness across accounts is not checked. A transfer to oneself fails because the receiver owns a pet.
 * </span>
 *
 * @author vevoly
 * @since 1.0.0
 */
public class PetCommandDispatcher implements CommandDispatcher {

    @Override
    public PetEvent dispatch(LedgerStore store, AccountId sender, PetCommand command, long height) throws PetLedgerException {
        switch (command.getType()) {
            case MINT:
                return mint(store, sender, (MintCommand) command);
            case TRANSFER:
                return transfer(store, sender, (TransferCommand) command);
            case FEED:
                return feed(store, sender, height);
            case SLEEP:
                return sleep(store, sender, height);
            default:
                throw new IllegalStateException("Unhandled command type: " + command.getType());
        }
    }

    private PetEvent mint(LedgerStore store, AccountId sender, MintCommand command) throws PetLedgerException {
        if (store.get(sender).isPresent()) {
            throw new AccountAlreadyHasPetException(sender);
        }
        PetRecord record = PetRecord.of(command.getPetId(), command.getName(), command.getSpecies());
        store.put(sender, record);
        return new PetMinted(sender, record.getId());
    }

    private PetEvent transfer(LedgerStore store, AccountId sender, TransferCommand command) throws PetLedgerException {
        PetRecord record = store.get(sender).orElseThrow(() -> new AccountHasNoPetException(sender));
        AccountId receiver = command.getReceiver();
        if (store.get(receiver).isPresent()) {
            throw new AccountAlreadyHasPetException(receiver);
        }
        // 先写接收者再删发送者 / receiver first, then drop the sender entry
        store.put(receiver, record);
        store.remove(sender);
        return new PetTransferred(sender, receiver, record.getId());
    }

    private PetEvent feed(LedgerStore store, AccountId sender, long height) throws PetLedgerException {
        PetRecord record = store.get(sender).orElseThrow(() -> new AccountHasNoPetException(sender));
        store.setFeedTime(record.getId(), height);
        return new PetFed(sender, record.getId());
    }

    private PetEvent sleep(LedgerStore store, AccountId sender, long height) throws PetLedgerException {
        PetRecord record = store.get(sender).orElseThrow(() -> new AccountHasNoPetException(sender));
        store.setSleepTime(record.getId(), height);
        return new PetSlept(sender, record.getId());
    }
}
