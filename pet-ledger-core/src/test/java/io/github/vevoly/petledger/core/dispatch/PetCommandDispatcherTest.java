package io.github.vevoly.petledger.core.dispatch;

import io.github.vevoly.petledger.api.LedgerStore;
import io.github.vevoly.petledger.api.command.PetCommand;
import io.github.vevoly.petledger.api.event.PetEvent;
import io.github.vevoly.petledger.api.event.PetFed;
import io.github.vevoly.petledger.api.event.PetMinted;
import io.github.vevoly.petledger.api.event.PetSlept;
import io.github.vevoly.petledger.api.event.PetTransferred;
import io.github.vevoly.petledger.api.exception.AccountAlreadyHasPetException;
import io.github.vevoly.petledger.api.exception.AccountHasNoPetException;
import io.github.vevoly.petledger.api.exception.PetLedgerErrorCode;
import io.github.vevoly.petledger.api.model.AccountId;
import io.github.vevoly.petledger.api.model.PetRecord;
import io.github.vevoly.petledger.api.model.Species;
import io.github.vevoly.petledger.core.store.InMemoryLedgerStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PetCommandDispatcherTest {

    private final PetCommandDispatcher dispatcher = new PetCommandDispatcher();
    private final AccountId alice = AccountId.of("alice");
    private final AccountId bob = AccountId.of("bob");
    private InMemoryLedgerStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryLedgerStore();
    }

    @Test
    void mint_storesRecordAndEmitsPetMinted() throws Exception {
        PetEvent event = dispatcher.dispatch(store, alice, PetCommand.mint("Shelly", Species.TURTLE, 7), 1);

        assertThat(event).isEqualTo(new PetMinted(alice, 7));
        assertThat(store.get(alice)).contains(PetRecord.of(7, "Shelly", Species.TURTLE));
    }

    @Test
    void mint_whenSenderOwnsPet_failsAndLeavesStoreUnchanged() throws Exception {
        dispatcher.dispatch(store, alice, PetCommand.mint("Shelly", Species.TURTLE, 7), 1);

        assertThatThrownBy(() -> dispatcher.dispatch(store, alice, PetCommand.mint("Sly", Species.SNAKE, 8), 2))
                .isInstanceOf(AccountAlreadyHasPetException.class)
                .satisfies(e -> assertThat(((AccountAlreadyHasPetException) e).getErrorCode())
                        .isEqualTo(PetLedgerErrorCode.ACCOUNT_ALREADY_HAS_PET));

        assertThat(store.get(alice)).contains(PetRecord.of(7, "Shelly", Species.TURTLE));
        assertThat(store.size()).isEqualTo(1);
    }

    @Test
    void mint_sameIdOnTwoAccounts_bothSucceed() throws Exception {
        dispatcher.dispatch(store, alice, PetCommand.mint("Shelly", Species.TURTLE, 7), 1);
        dispatcher.dispatch(store, bob, PetCommand.mint("Hops", Species.RABBIT, 7), 1);

        assertThat(store.get(alice).map(PetRecord::getId)).contains(7L);
        assertThat(store.get(bob).map(PetRecord::getId)).contains(7L);
    }

    @Test
    void transfer_movesRecordAndEmitsPetTransferred() throws Exception {
        dispatcher.dispatch(store, alice, PetCommand.mint("Shelly", Species.TURTLE, 7), 1);

        PetEvent event = dispatcher.dispatch(store, alice, PetCommand.transfer(bob), 2);

        assertThat(event).isEqualTo(new PetTransferred(alice, bob, 7));
        assertThat(store.get(alice)).isEmpty();
        assertThat(store.get(bob)).contains(PetRecord.of(7, "Shelly", Species.TURTLE));
    }

    @Test
    void transfer_roundTripRestoresIdenticalRecord() throws Exception {
        dispatcher.dispatch(store, alice, PetCommand.mint("Shelly", Species.TURTLE, 7), 1);
        PetRecord minted = store.get(alice).orElseThrow();

        dispatcher.dispatch(store, alice, PetCommand.transfer(bob), 2);
        dispatcher.dispatch(store, bob, PetCommand.transfer(alice), 3);

        assertThat(store.get(alice)).contains(minted);
        assertThat(store.get(bob)).isEmpty();
    }

    @Test
    void transfer_keepsActivityTimestamps() throws Exception {
        dispatcher.dispatch(store, alice, PetCommand.mint("Shelly", Species.TURTLE, 7), 1);
        dispatcher.dispatch(store, alice, PetCommand.feed(), 3);
        dispatcher.dispatch(store, alice, PetCommand.sleep(), 4);

        dispatcher.dispatch(store, alice, PetCommand.transfer(bob), 5);

        assertThat(store.feedTimeOf(7)).isEqualTo(3);
        assertThat(store.sleepTimeOf(7)).hasValue(4);
    }

    @Test
    void transfer_toOwner_failsWithReceiverAccount() throws Exception {
        dispatcher.dispatch(store, alice, PetCommand.mint("Shelly", Species.TURTLE, 7), 1);
        dispatcher.dispatch(store, bob, PetCommand.mint("Hops", Species.RABBIT, 9), 1);

        assertThatThrownBy(() -> dispatcher.dispatch(store, alice, PetCommand.transfer(bob), 2))
                .isInstanceOf(AccountAlreadyHasPetException.class)
                .satisfies(e -> assertThat(((AccountAlreadyHasPetException) e).getAccount()).isEqualTo(bob));

        assertThat(store.get(alice).map(PetRecord::getId)).contains(7L);
        assertThat(store.get(bob).map(PetRecord::getId)).contains(9L);
    }

    @Test
    void transfer_toSelf_fails() throws Exception {
        dispatcher.dispatch(store, alice, PetCommand.mint("Shelly", Species.TURTLE, 7), 1);

        assertThatThrownBy(() -> dispatcher.dispatch(store, alice, PetCommand.transfer(alice), 2))
                .isInstanceOf(AccountAlreadyHasPetException.class);
        assertThat(store.get(alice)).isPresent();
    }

    @Test
    void transfer_withoutPet_fails() {
        assertThatThrownBy(() -> dispatcher.dispatch(store, alice, PetCommand.transfer(bob), 1))
                .isInstanceOf(AccountHasNoPetException.class)
                .satisfies(e -> assertThat(((AccountHasNoPetException) e).getAccount()).isEqualTo(alice));
    }

    @Test
    void feed_recordsLatestHeight() throws Exception {
        dispatcher.dispatch(store, alice, PetCommand.mint("Shelly", Species.TURTLE, 7), 1);

        assertThat(dispatcher.dispatch(store, alice, PetCommand.feed(), 5)).isEqualTo(new PetFed(alice, 7));
        dispatcher.dispatch(store, alice, PetCommand.feed(), 9);

        assertThat(store.feedTimeOf(7)).isEqualTo(9);
    }

    @Test
    void sleep_presenceDistinguishesNeverSlept() throws Exception {
        dispatcher.dispatch(store, alice, PetCommand.mint("Shelly", Species.TURTLE, 7), 1);
        assertThat(store.sleepTimeOf(7)).isEmpty();

        assertThat(dispatcher.dispatch(store, alice, PetCommand.sleep(), 6)).isEqualTo(new PetSlept(alice, 7));

        assertThat(store.sleepTimeOf(7)).hasValue(6);
    }

    @Test
    void feedAndSleep_withoutPet_failAndWriteNothing() {
        LedgerStore mocked = mock(LedgerStore.class);
        when(mocked.get(alice)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> dispatcher.dispatch(mocked, alice, PetCommand.feed(), 3))
                .isInstanceOf(AccountHasNoPetException.class);
        assertThatThrownBy(() -> dispatcher.dispatch(mocked, alice, PetCommand.sleep(), 3))
                .isInstanceOf(AccountHasNoPetException.class);

        verify(mocked, never()).setFeedTime(anyLong(), anyLong());
        verify(mocked, never()).setSleepTime(anyLong(), anyLong());
        verify(mocked, never()).put(any(), any());
    }

    @Test
    void failedTransfer_neverWrites() {
        LedgerStore mocked = mock(LedgerStore.class);
        when(mocked.get(alice)).thenReturn(Optional.of(PetRecord.of(7, "Shelly", Species.TURTLE)));
        when(mocked.get(bob)).thenReturn(Optional.of(PetRecord.of(9, "Hops", Species.RABBIT)));

        assertThatThrownBy(() -> dispatcher.dispatch(mocked, alice, PetCommand.transfer(bob), 2))
                .isInstanceOf(AccountAlreadyHasPetException.class);

        verify(mocked, never()).put(any(), any());
        verify(mocked, never()).remove(any());
    }
}
