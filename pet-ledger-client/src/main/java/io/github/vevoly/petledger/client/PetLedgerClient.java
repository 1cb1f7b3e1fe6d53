package io.github.vevoly.petledger.client;

import io.github.vevoly.petledger.api.LedgerTransport;
import io.github.vevoly.petledger.api.codec.CommandCodec;
import io.github.vevoly.petledger.api.command.PetCommand;
import io.github.vevoly.petledger.api.crypto.Signer;
import io.github.vevoly.petledger.api.exception.PetNameTooLongException;
import io.github.vevoly.petledger.api.model.AccountId;
import io.github.vevoly.petledger.api.model.PetRecord;
import io.github.vevoly.petledger.api.model.Species;
import io.github.vevoly.petledger.api.tx.SignedCommand;
import io.github.vevoly.petledger.api.tx.TxStatusStream;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * <h3>提交客户端 (Submission Client)</h3>
 *
 * <p>
 * 以单个账户身份构造、签名并提交命令。每次提交生成新的 {@code txId}，因此相同命令的两次提交是两笔不同的交易。
 * 名称超长在签名前同步失败，不会产生任何传输流量。
 * </p>
 *
 * <hr>
 *
 * <span style="color: gray; font-size: 0.9em;">
 * <b>Submission Client.</b><br>
 * Builds, signs and submits commands as one account. Each submission gets a fresh {@code txId},
 * so submitting the same command twice yields two distinct transactions.
 * An over-long name fails synchronously before signing, with no transport traffic.
 * </span>
 *
 * @author vevoly
 * @since 1.0.0
 */
@Slf4j
public class PetLedgerClient {

    private final LedgerTransport transport;
    @Getter
    private final Signer signer;
    private final CommandCodec codec;

    public PetLedgerClient(LedgerTransport transport, Signer signer) {
        this(transport, signer, new CommandCodec());
    }

    public PetLedgerClient(LedgerTransport transport, Signer signer, CommandCodec codec) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.signer = Objects.requireNonNull(signer, "signer");
        this.codec = Objects.requireNonNull(codec, "codec");
    }

    public AccountId getAccount() {
        return signer.getAccount();
    }

    /**
     * 签名并提交命令 (Sign and submit a command).
     *
     * @param command 命令 (Command)
     * @return 提交句柄 (Submission handle)
     * @throws PetNameTooLongException 名称超过编码上限 / name exceeds the codec bound
     */
    public SubmittedTx submit(PetCommand command) throws PetNameTooLongException {
        SignedCommand envelope = codec.seal(signer, UUID.randomUUID().toString(), command);
        TxStatusStream statuses = transport.submit(envelope);
        log.debug("Submitted {} from {} as tx {}", command.getType(), envelope.getSigner(), envelope.getTxHash());
        return new SubmittedTx(envelope.getTxHash(), envelope.getSigner(), command, statuses);
    }

    public SubmittedTx mint(String name, Species species, long petId) throws PetNameTooLongException {
        return submit(PetCommand.mint(name, species, petId));
    }

    public SubmittedTx transfer(AccountId receiver) {
        return submitNameless(PetCommand.transfer(receiver));
    }

    public SubmittedTx feed() {
        return submitNameless(PetCommand.feed());
    }

    public SubmittedTx sleep() {
        return submitNameless(PetCommand.sleep());
    }

    /**
     * 提交并异步等待确认 (Submit, then watch for confirmation asynchronously).
     */
    public CompletableFuture<ConfirmationOutcome> submitAndWatch(PetCommand command, ConfirmationWatcher watcher)
            throws PetNameTooLongException {
        return watcher.watch(submit(command));
    }

    // 无名称命令不会触发名称上限 / commands without a name never hit the name bound
    private SubmittedTx submitNameless(PetCommand command) {
        try {
            return submit(command);
        } catch (PetNameTooLongException e) {
            throw new IllegalStateException("Name bound reported for " + command.getType(), e);
        }
    }

    public Optional<PetRecord> myPet() {
        return transport.petOf(getAccount());
    }

    public Optional<PetRecord> petOf(AccountId account) {
        return transport.petOf(account);
    }
}
