package io.github.vevoly.petledger.api.codec;

import io.github.vevoly.petledger.api.command.PetCommand;
import io.github.vevoly.petledger.api.crypto.Ed25519;
import io.github.vevoly.petledger.api.crypto.Signer;
import io.github.vevoly.petledger.api.exception.PetLedgerErrorCode;
import io.github.vevoly.petledger.api.exception.PetNameTooLongException;
import io.github.vevoly.petledger.api.model.AccountId;
import io.github.vevoly.petledger.api.model.Species;
import io.github.vevoly.petledger.api.tx.SignedCommand;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CommandCodecTest {

    private final CommandCodec codec = new CommandCodec();
    private final AccountId alice = AccountId.of("alice");

    @Test
    void checkName_acceptsNameAtTheBound() {
        assertThatCode(() -> codec.checkName("x".repeat(32))).doesNotThrowAnyException();
    }

    @Test
    void checkName_rejectsNameOverTheBound() {
        assertThatThrownBy(() -> codec.checkName("x".repeat(33)))
                .isInstanceOf(PetNameTooLongException.class)
                .satisfies(e -> {
                    PetNameTooLongException ex = (PetNameTooLongException) e;
                    assertThat(ex.getErrorCode()).isEqualTo(PetLedgerErrorCode.PET_NAME_TOO_LONG);
                    assertThat(ex.getLength()).isEqualTo(33);
                    assertThat(ex.getMaxLength()).isEqualTo(32);
                });
    }

    @Test
    void checkName_measuresUtf8Bytes() {
        // 17 characters, 34 bytes
        assertThatThrownBy(() -> codec.checkName("é".repeat(17)))
                .isInstanceOf(PetNameTooLongException.class);
    }

    @Test
    void encodePayload_honoursConfiguredBound() {
        CommandCodec tight = new CommandCodec(4);

        assertThatCode(() -> tight.encodePayload(alice, "tx-1", PetCommand.mint("Bob", Species.SNAKE, 1)))
                .doesNotThrowAnyException();
        assertThatThrownBy(() -> tight.encodePayload(alice, "tx-1", PetCommand.mint("Bobby", Species.SNAKE, 1)))
                .isInstanceOf(PetNameTooLongException.class);
    }

    @Test
    void encodePayload_isDeterministicAndBindsEveryField() throws Exception {
        byte[] first = codec.encodePayload(alice, "tx-1", PetCommand.mint("Shelly", Species.TURTLE, 7));
        byte[] again = codec.encodePayload(alice, "tx-1", PetCommand.mint("Shelly", Species.TURTLE, 7));

        assertThat(first).isEqualTo(again);
        assertThat(codec.encodePayload(alice, "tx-2", PetCommand.mint("Shelly", Species.TURTLE, 7))).isNotEqualTo(first);
        assertThat(codec.encodePayload(AccountId.of("bob"), "tx-1", PetCommand.mint("Shelly", Species.TURTLE, 7))).isNotEqualTo(first);
        assertThat(codec.encodePayload(alice, "tx-1", PetCommand.mint("Shelly", Species.RABBIT, 7))).isNotEqualTo(first);
        assertThat(codec.encodePayload(alice, "tx-1", PetCommand.mint("Shelly", Species.TURTLE, 8))).isNotEqualTo(first);
        assertThat(codec.encodePayload(alice, "tx-1", PetCommand.feed()))
                .isNotEqualTo(codec.encodePayload(alice, "tx-1", PetCommand.sleep()));
    }

    @Test
    void encodePayload_keepsFullUint32PetId() throws Exception {
        byte[] max = codec.encodePayload(alice, "tx-1", PetCommand.mint("Max", Species.TURTLE, 0xFFFF_FFFFL));
        byte[] zero = codec.encodePayload(alice, "tx-1", PetCommand.mint("Max", Species.TURTLE, 0));

        assertThat(max).hasSameSizeAs(zero).isNotEqualTo(zero);
    }

    @Test
    void seal_signsPayloadAndHashesIt() throws Exception {
        Signer signer = Ed25519.generateSigner();

        SignedCommand envelope = codec.seal(signer, "tx-1", PetCommand.transfer(alice));

        assertThat(envelope.getSigner()).isEqualTo(signer.getAccount());
        assertThat(envelope.getTxHash()).isEqualTo(CommandCodec.hash(envelope.getPayload())).hasSize(64);
        assertThat(Ed25519.verifier().verify(signer.getAccount(), envelope.getPayload(), envelope.getSignature())).isTrue();
    }

    @Test
    void constructor_rejectsNonPositiveBound() {
        assertThatThrownBy(() -> new CommandCodec(0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void seal_acceptsReceiverAddressBeyond64KiB() throws Exception {
        Signer signer = Ed25519.generateSigner();
        AccountId receiver = AccountId.of("a".repeat(70_000));

        SignedCommand envelope = codec.seal(signer, "tx-1", PetCommand.transfer(receiver));

        assertThat(envelope.getPayload().length).isGreaterThan(70_000);
        assertThat(Ed25519.verifier().verify(signer.getAccount(), envelope.getPayload(), envelope.getSignature())).isTrue();
    }

    @Test
    void encodePayload_acceptsLargeConfiguredNameBound() throws Exception {
        CommandCodec wide = new CommandCodec(100_000);

        byte[] payload = wide.encodePayload(alice, "tx-1", PetCommand.mint("n".repeat(70_000), Species.SNAKE, 1));

        assertThat(payload.length).isGreaterThan(70_000);
        assertThatThrownBy(() -> wide.encodePayload(alice, "tx-1", PetCommand.mint("n".repeat(100_001), Species.SNAKE, 1)))
                .isInstanceOf(PetNameTooLongException.class);
    }

    @Test
    void encodePayload_lengthPrefixSeparatesAdjacentFields() throws Exception {
        byte[] first = codec.encodePayload(AccountId.of("ab"), "tx", PetCommand.transfer(AccountId.of("c")));
        byte[] second = codec.encodePayload(AccountId.of("a"), "tx", PetCommand.transfer(AccountId.of("bc")));

        assertThat(first).isNotEqualTo(second);
    }
}
