package io.github.vevoly.petledger.client;

import io.github.vevoly.petledger.api.LedgerTransport;
import io.github.vevoly.petledger.api.command.PetCommand;
import io.github.vevoly.petledger.api.event.EventRecord;
import io.github.vevoly.petledger.api.event.PetFed;
import io.github.vevoly.petledger.api.event.PetMinted;
import io.github.vevoly.petledger.api.exception.PetLedgerErrorCode;
import io.github.vevoly.petledger.api.exception.UnknownBlockException;
import io.github.vevoly.petledger.api.model.AccountId;
import io.github.vevoly.petledger.api.model.Species;
import io.github.vevoly.petledger.api.tx.BlockRef;
import io.github.vevoly.petledger.api.tx.TxReceipt;
import io.github.vevoly.petledger.api.tx.TxStatus;
import io.github.vevoly.petledger.api.tx.TxStatusStream;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ConfirmationWatcherTest {

    private static final String TX = "aa01";
    private static final BlockRef B1 = new BlockRef(1, "b1");
    private static final AccountId ALICE = AccountId.of("alice");

    @Mock
    private LedgerTransport transport;

    private ConfirmationWatcher watcher;

    @BeforeEach
    void setUp() {
        watcher = ConfirmationWatcher.builder()
                .transport(transport)
                .statusTimeout(Duration.ofMillis(300))
                .build();
    }

    @AfterEach
    void tearDown() {
        watcher.close();
    }

    private SubmittedTx mintTx(TxStatus... statuses) {
        TxStatusStream stream = new TxStatusStream(TX);
        for (TxStatus status : statuses) {
            stream.publish(status);
        }
        return new SubmittedTx(TX, ALICE, PetCommand.mint("Rex", Species.RABBIT, 7), stream);
    }

    @Test
    void await_finalizedWithMatchingEvent_isSuccess() throws Exception {
        PetMinted minted = new PetMinted(ALICE, 7);
        when(transport.fetchEvents(B1)).thenReturn(List.of(
                new EventRecord(0, 1, 0, "other", new PetMinted(ALICE, 8)),
                new EventRecord(1, 1, 1, TX, minted)));

        ConfirmationOutcome outcome = watcher.await(mintTx(TxStatus.ready(), TxStatus.inBlock(B1), TxStatus.finalized(B1)));

        assertThat(outcome.isSuccess()).isTrue();
        assertThat(outcome.getKind()).isEqualTo(ConfirmationOutcome.Kind.FINALIZED);
        assertThat(outcome.getBlock()).isEqualTo(B1);
        assertThat(outcome.getEvent()).isEqualTo(minted);
        verify(transport, never()).fetchReceipt(any(), any());
    }

    @Test
    void await_inBlockThenStreamEnds_isIndeterminate() {
        SubmittedTx tx = mintTx(TxStatus.ready(), TxStatus.inBlock(B1));
        tx.getStatuses().end();

        ConfirmationOutcome outcome = watcher.await(tx);

        assertThat(outcome.getKind()).isEqualTo(ConfirmationOutcome.Kind.INDETERMINATE);
        assertThat(outcome.isSuccess()).isFalse();
        assertThat(outcome.requiresRequery()).isTrue();
    }

    @Test
    void await_readyThenStreamEnds_isIndeterminate() {
        SubmittedTx tx = mintTx(TxStatus.ready());
        tx.getStatuses().end();

        assertThat(watcher.await(tx).getKind()).isEqualTo(ConfirmationOutcome.Kind.INDETERMINATE);
    }

    @Test
    void await_noStatusWithinTimeout_isIndeterminate() {
        ConfirmationOutcome outcome = watcher.await(mintTx(TxStatus.ready()));

        assertThat(outcome.getKind()).isEqualTo(ConfirmationOutcome.Kind.INDETERMINATE);
        assertThat(outcome.getDetail()).contains("READY");
    }

    @Test
    void await_invalid_isRejectedWithReason() {
        ConfirmationOutcome outcome = watcher.await(mintTx(TxStatus.invalid("DUPLICATE_TRANSACTION: seen")));

        assertThat(outcome.getKind()).isEqualTo(ConfirmationOutcome.Kind.REJECTED);
        assertThat(outcome.getStatus().getKind()).isEqualTo(TxStatus.Kind.INVALID);
        assertThat(outcome.getDetail()).startsWith("DUPLICATE_TRANSACTION");
        assertThat(outcome.requiresRequery()).isFalse();
    }

    @Test
    void await_droppedAfterReady_isRejected() {
        ConfirmationOutcome outcome = watcher.await(mintTx(TxStatus.ready(), TxStatus.dropped("pool full")));

        assertThat(outcome.getKind()).isEqualTo(ConfirmationOutcome.Kind.REJECTED);
        assertThat(outcome.getStatus().getKind()).isEqualTo(TxStatus.Kind.DROPPED);
    }

    @Test
    void await_finalizedWithFailedReceipt_isDispatchFailed() throws Exception {
        when(transport.fetchEvents(B1)).thenReturn(List.of());
        when(transport.fetchReceipt(B1, TX)).thenReturn(
                Optional.of(TxReceipt.failure(TX, 0, 1, PetLedgerErrorCode.ACCOUNT_ALREADY_HAS_PET)));

        ConfirmationOutcome outcome = watcher.await(mintTx(TxStatus.inBlock(B1), TxStatus.finalized(B1)));

        assertThat(outcome.getKind()).isEqualTo(ConfirmationOutcome.Kind.DISPATCH_FAILED);
        assertThat(outcome.getError()).isEqualTo(PetLedgerErrorCode.ACCOUNT_ALREADY_HAS_PET);
    }

    @Test
    void await_finalizedWithWrongEventType_isNoMatchingEvent() throws Exception {
        when(transport.fetchEvents(B1)).thenReturn(List.of(new EventRecord(0, 1, 0, TX, new PetFed(ALICE, 7))));
        when(transport.fetchReceipt(B1, TX)).thenReturn(Optional.of(TxReceipt.success(TX, 0, 1)));

        ConfirmationOutcome outcome = watcher.await(mintTx(TxStatus.finalized(B1)));

        assertThat(outcome.getKind()).isEqualTo(ConfirmationOutcome.Kind.NO_MATCHING_EVENT);
        assertThat(outcome.requiresRequery()).isTrue();
    }

    @Test
    void await_eventFetchFails_isNoMatchingEvent() throws Exception {
        when(transport.fetchEvents(B1)).thenThrow(new UnknownBlockException(B1));

        ConfirmationOutcome outcome = watcher.await(mintTx(TxStatus.finalized(B1)));

        assertThat(outcome.getKind()).isEqualTo(ConfirmationOutcome.Kind.NO_MATCHING_EVENT);
        assertThat(outcome.getBlock()).isEqualTo(B1);
    }

    @Test
    void await_always_closesStream() {
        SubmittedTx tx = mintTx(TxStatus.invalid("INVALID_SIGNATURE: bad"));

        watcher.await(tx);

        assertThat(tx.getStatuses().isCancelled()).isTrue();
    }

    @Test
    void watch_cancelledFuture_closesStream() throws Exception {
        SubmittedTx tx = mintTx(TxStatus.ready());
        ConfirmationWatcher slow = ConfirmationWatcher.builder()
                .transport(transport)
                .statusTimeout(Duration.ofSeconds(30))
                .build();
        try {
            CompletableFuture<ConfirmationOutcome> future = slow.watch(tx);
            future.cancel(true);

            assertThat(tx.getStatuses().isCancelled()).isTrue();
        } finally {
            slow.close();
        }
    }

    @Test
    void watch_afterClose_isIndeterminateAndClosesStream() throws Exception {
        SubmittedTx tx = mintTx(TxStatus.ready());
        watcher.close();

        ConfirmationOutcome outcome = watcher.watch(tx).get(1, TimeUnit.SECONDS);

        assertThat(outcome.getKind()).isEqualTo(ConfirmationOutcome.Kind.INDETERMINATE);
        assertThat(outcome.getTxHash()).isEqualTo(TX);
        assertThat(tx.getStatuses().isCancelled()).isTrue();
    }

    @Test
    void watch_completesAsynchronously() throws Exception {
        SubmittedTx tx = mintTx(TxStatus.ready());
        CompletableFuture<ConfirmationOutcome> future = watcher.watch(tx);
        tx.getStatuses().publish(TxStatus.error("node stopped"));

        ConfirmationOutcome outcome = future.get(5, TimeUnit.SECONDS);

        assertThat(outcome.getKind()).isEqualTo(ConfirmationOutcome.Kind.REJECTED);
        assertThat(outcome.getStatus().getKind()).isEqualTo(TxStatus.Kind.ERROR);
    }
}
