package io.github.vevoly.petledger.api.crypto;

import io.github.vevoly.petledger.api.model.AccountId;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

class Ed25519Test {

    private final byte[] payload = "feed the turtle".getBytes(StandardCharsets.UTF_8);

    @Test
    void generateSigner_derivesHexAddressFromPublicKey() {
        Signer signer = Ed25519.generateSigner();

        assertThat(signer.getAccount().getAddress()).matches("[0-9a-f]{64}");
    }

    @Test
    void verify_acceptsOwnSignature() {
        Signer signer = Ed25519.generateSigner();

        assertThat(Ed25519.verifier().verify(signer.getAccount(), payload, signer.sign(payload))).isTrue();
    }

    @Test
    void verify_rejectsTamperedPayload() {
        Signer signer = Ed25519.generateSigner();
        byte[] signature = signer.sign(payload);
        byte[] tampered = payload.clone();
        tampered[0] ^= 1;

        assertThat(Ed25519.verifier().verify(signer.getAccount(), tampered, signature)).isFalse();
    }

    @Test
    void verify_rejectsSignatureOfAnotherAccount() {
        Signer signer = Ed25519.generateSigner();
        Signer other = Ed25519.generateSigner();

        assertThat(Ed25519.verifier().verify(other.getAccount(), payload, signer.sign(payload))).isFalse();
    }

    @Test
    void verify_rejectsAddressThatIsNotAKey() {
        Signer signer = Ed25519.generateSigner();

        assertThat(Ed25519.verifier().verify(AccountId.of("alice"), payload, signer.sign(payload))).isFalse();
        assertThat(Ed25519.verifier().verify(signer.getAccount(), payload, new byte[0])).isFalse();
    }
}
