package io.github.vevoly.petledger.core.snapshot;

import io.github.vevoly.petledger.api.exception.PetLedgerErrorCode;
import io.github.vevoly.petledger.api.exception.PetLedgerException;
import io.github.vevoly.petledger.api.model.AccountId;
import io.github.vevoly.petledger.api.model.PetRecord;
import io.github.vevoly.petledger.api.model.Species;
import io.github.vevoly.petledger.api.tx.BlockRef;
import io.github.vevoly.petledger.core.idempotency.BloomIdempotencyStrategy;
import io.github.vevoly.petledger.core.idempotency.LruIdempotencyStrategy;
import io.github.vevoly.petledger.core.store.InMemoryLedgerStore;
import io.github.vevoly.petledger.core.store.PetLedgerState;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SnapshotManagerTest {

    @TempDir
    Path dir;

    private final AccountId alice = AccountId.of("alice");

    @Test
    void load_withoutSnapshotReturnsNull() throws Exception {
        SnapshotManager<PetLedgerState> manager = new SnapshotManager<>(dir.toString(), PetLedgerState.class);

        assertThat(manager.load()).isNull();
    }

    @Test
    void saveThenLoad_restoresStateHeadAndLruStrategy() throws Exception {
        SnapshotManager<PetLedgerState> manager = new SnapshotManager<>(dir.toString(), PetLedgerState.class);
        InMemoryLedgerStore store = new InMemoryLedgerStore();
        store.put(alice, PetRecord.of(7, "Shelly", Species.TURTLE));
        store.setFeedTime(7, 3);
        store.setSleepTime(7, 0);
        LruIdempotencyStrategy strategy = new LruIdempotencyStrategy(2);
        strategy.add("tx-1");

        manager.save(new BlockRef(4, "abcd"), store.getState(), strategy, "[test]");
        SnapshotContainer<PetLedgerState> loaded = manager.load();

        assertThat(loaded.getHead()).isEqualTo(new BlockRef(4, "abcd"));
        InMemoryLedgerStore restored = new InMemoryLedgerStore(loaded.getState());
        assertThat(restored.get(alice)).contains(PetRecord.of(7, "Shelly", Species.TURTLE));
        assertThat(restored.feedTimeOf(7)).isEqualTo(3);
        assertThat(restored.sleepTimeOf(7)).hasValue(0);
        assertThat(loaded.getIdempotencyStrategy().contains("tx-1")).isTrue();

        // 容量上限随快照保留 / capacity survives the snapshot
        loaded.getIdempotencyStrategy().add("tx-2");
        loaded.getIdempotencyStrategy().add("tx-3");
        assertThat(loaded.getIdempotencyStrategy().contains("tx-1")).isFalse();
    }

    @Test
    void saveThenLoad_restoresBloomStrategy() throws Exception {
        SnapshotManager<PetLedgerState> manager = new SnapshotManager<>(dir.toString(), PetLedgerState.class);
        BloomIdempotencyStrategy strategy = new BloomIdempotencyStrategy(1_000, 0.001);
        strategy.add("tx-1");

        manager.save(new BlockRef(1, "ff"), new PetLedgerState(), strategy, "[test]");

        assertThat(manager.load().getIdempotencyStrategy().contains("tx-1")).isTrue();
    }

    @Test
    void load_corruptedFileFails() throws Exception {
        SnapshotManager<PetLedgerState> manager = new SnapshotManager<>(dir.toString(), PetLedgerState.class);
        Files.write(dir.resolve("snapshot").resolve("snapshot.dat"), "not kryo".getBytes(StandardCharsets.UTF_8));

        assertThatThrownBy(manager::load)
                .isInstanceOf(PetLedgerException.class)
                .satisfies(e -> assertThat(((PetLedgerException) e).getErrorCode())
                        .isEqualTo(PetLedgerErrorCode.SNAPSHOT_LOAD_FAILED));
    }
}
