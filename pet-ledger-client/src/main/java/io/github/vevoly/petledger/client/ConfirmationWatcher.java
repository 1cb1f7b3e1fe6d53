package io.github.vevoly.petledger.client;

import io.github.vevoly.petledger.api.LedgerTransport;
import io.github.vevoly.petledger.api.constants.PetLedgerConstant;
import io.github.vevoly.petledger.api.event.EventRecord;
import io.github.vevoly.petledger.api.event.EventType;
import io.github.vevoly.petledger.api.exception.UnknownBlockException;
import io.github.vevoly.petledger.api.tx.BlockRef;
import io.github.vevoly.petledger.api.tx.TxReceipt;
import io.github.vevoly.petledger.api.tx.TxStatus;
import io.github.vevoly.petledger.api.tx.TxStatusStream;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * <h3>确认监听器 (Confirmation Watcher)</h3>
 *
 * <p>
 * 消费一笔交易的状态流并给出最终结论：
 * </p>
 * <ul>
 *     <li>READY 忽略；IN_BLOCK 仅推进内部状态，不代表成功。</li>
 *     <li>FINALIZED 时拉取该区块的事件，按交易哈希与期望事件类型匹配；匹配即成功。</li>
 *     <li>找不到匹配事件时，若回执表明调度失败则为 DISPATCH_FAILED，否则为 NO_MATCHING_EVENT。</li>
 *     <li>DROPPED / INVALID / ERROR 为 REJECTED。</li>
 *     <li>流在终态前结束或等待超时为 INDETERMINATE，调用方必须重新查询。</li>
 * </ul>
 *
 * <hr>
 *
 * <span style="color: gray; font-size: 0.9em;">
 * <b>Confirmation Watcher.</b><br>
 * Consumes one transaction's status stream and reaches a final verdict. READY is ignored and IN_BLOCK only
 * advances internal state. On FINALIZED the block's events are fetched and matched by tx hash and expected type.
 * A stream that ends before a terminal status, or a timeout, is INDETERMINATE and never a success.
 * </span>
 *
 * @author vevoly
 * @since 1.0.0
 */
@Slf4j
public class ConfirmationWatcher implements AutoCloseable {

    /**
     * 单笔交易的观察进度 (Per-transaction watch progress).
     */
    enum WatchState {
        SUBMITTED,
        READY,
        IN_BLOCK,
        RESOLVED
    }

    private final LedgerTransport transport;
    private final Duration statusTimeout;
    private final ExecutorService executor;
    private final boolean ownsExecutor;

    private ConfirmationWatcher(Builder builder) {
        this.transport = builder.transport;
        this.statusTimeout = builder.statusTimeout;
        if (builder.executor != null) {
            this.executor = builder.executor;
            this.ownsExecutor = false;
        } else {
            AtomicInteger threadIndex = new AtomicInteger();
            this.executor = Executors.newCachedThreadPool(r -> {
                Thread t = new Thread(r, "PetLedger-Watcher-" + threadIndex.incrementAndGet());
                t.setDaemon(true);
                return t;
            });
            this.ownsExecutor = true;
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * 异步观察 (Watch asynchronously). 取消返回的 future 会关闭状态流 / cancelling the future closes the stream.
     * 观察器关闭后调用立即得到 {@code INDETERMINATE} 并关闭状态流 /
     * after {@link #close()} the stream is closed and the outcome is {@code INDETERMINATE} right away.
     */
    public CompletableFuture<ConfirmationOutcome> watch(SubmittedTx tx) {
        CompletableFuture<ConfirmationOutcome> future;
        try {
            future = CompletableFuture.supplyAsync(() -> await(tx), executor);
        } catch (RejectedExecutionException e) {
            log.warn("Watcher is closed, tx {} left unwatched", tx.getTxHash());
            tx.close();
            return CompletableFuture.completedFuture(ConfirmationOutcome.indeterminate(tx.getTxHash(), "Watcher is closed"));
        }
        future.whenComplete((outcome, error) -> {
            if (future.isCancelled()) {
                tx.close();
            }
        });
        return future;
    }

    /**
     * 在当前线程阻塞等待结论 (Block the calling thread until a verdict).
     */
    public ConfirmationOutcome await(SubmittedTx tx) {
        String txHash = tx.getTxHash();
        TxStatusStream statuses = tx.getStatuses();
        WatchState state = WatchState.SUBMITTED;
        try {
            while (true) {
                Optional<TxStatus> next;
                try {
                    next = statuses.next(statusTimeout);
                } catch (TimeoutException e) {
                    log.warn("Tx {} timed out in state {} after {}", txHash, state, statusTimeout);
                    return ConfirmationOutcome.indeterminate(txHash, "No status within " + statusTimeout + " in state " + state);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return ConfirmationOutcome.indeterminate(txHash, "Interrupted in state " + state);
                }

                if (next.isEmpty()) {
                    log.warn("Status stream of tx {} ended in state {} without a terminal status", txHash, state);
                    return ConfirmationOutcome.indeterminate(txHash, "Stream ended in state " + state);
                }

                TxStatus status = next.get();
                switch (status.getKind()) {
                    case READY:
                        state = WatchState.READY;
                        break;
                    case IN_BLOCK:
                        state = WatchState.IN_BLOCK;
                        log.debug("Tx {} included in block {}", txHash, status.getBlock());
                        break;
                    case FINALIZED:
                        state = WatchState.RESOLVED;
                        return resolveFinalized(txHash, status.getBlock(), tx.getExpectedEvent());
                    default:
                        state = WatchState.RESOLVED;
                        log.info("Tx {} rejected: {} {}", txHash, status.getKind(), status.getDetail());
                        return ConfirmationOutcome.rejected(txHash, status);
                }
            }
        } finally {
            statuses.close();
        }
    }

    private ConfirmationOutcome resolveFinalized(String txHash, BlockRef block, EventType expected) {
        List<EventRecord> events;
        try {
            events = transport.fetchEvents(block);
        } catch (UnknownBlockException | RuntimeException e) {
            log.warn("Could not fetch events of finalized block {} for tx {}", block, txHash, e);
            return ConfirmationOutcome.noMatchingEvent(txHash, block, "Event fetch failed: " + e.getMessage());
        }

        for (EventRecord record : events) {
            if (record.isFrom(txHash) && record.getEvent().getType() == expected) {
                log.debug("Tx {} finalized in block {} with {}", txHash, block, record.getEvent());
                return ConfirmationOutcome.finalized(txHash, block, record.getEvent());
            }
        }

        Optional<TxReceipt> receipt;
        try {
            receipt = transport.fetchReceipt(block, txHash);
        } catch (UnknownBlockException | RuntimeException e) {
            log.warn("Could not fetch receipt of tx {} in block {}", txHash, block, e);
            receipt = Optional.empty();
        }
        if (receipt.isPresent() && !receipt.get().isSuccess()) {
            log.info("Tx {} finalized in block {} but dispatch failed: {}", txHash, block, receipt.get().getError());
            return ConfirmationOutcome.dispatchFailed(txHash, block, receipt.get().getError());
        }
        log.warn("Tx {} finalized in block {} without a {} event", txHash, block, expected);
        return ConfirmationOutcome.noMatchingEvent(txHash, block, "No " + expected + " event for tx");
    }

    @Override
    public void close() {
        if (ownsExecutor) {
            executor.shutdownNow();
        }
    }

    public static class Builder {
        private LedgerTransport transport;
        private Duration statusTimeout = PetLedgerConstant.DEFAULT_STATUS_TIMEOUT;
        private ExecutorService executor;

        public Builder transport(LedgerTransport transport) {
            this.transport = transport;
            return this;
        }

        public Builder statusTimeout(Duration timeout) {
            this.statusTimeout = timeout;
            return this;
        }

        /**
         * 外部线程池，由调用方负责关闭 (External pool; the caller owns its lifecycle).
         */
        public Builder executor(ExecutorService executor) {
            this.executor = executor;
            return this;
        }

        public ConfirmationWatcher build() {
            Objects.requireNonNull(transport, "transport");
            Objects.requireNonNull(statusTimeout, "statusTimeout");
            if (statusTimeout.isNegative() || statusTimeout.isZero()) {
                throw new IllegalArgumentException("statusTimeout must be positive");
            }
            return new ConfirmationWatcher(this);
        }
    }
}
