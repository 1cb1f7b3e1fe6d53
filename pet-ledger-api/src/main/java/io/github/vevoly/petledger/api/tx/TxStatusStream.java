package io.github.vevoly.petledger.api.tx;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * <h3>交易状态流 (Transaction Status Stream)</h3>
 *
 * <p>
 * 单笔提交的惰性、单次消费的状态序列，<b>不可重启</b>：重试必须重新提交。
 * 生产方（传输层）调用 {@link #publish(TxStatus)} / {@link #end()}；
 * 消费方（确认监听器）调用 {@link #next(Duration)}，这是唯一的挂起点。
 * 消费方可随时 {@link #close()} 放弃观察，这只停止观察，不会回滚账本上已发生的变更。
 * </p>
 *
 * <hr>
 *
 * <span style="color: gray; font-size: 0.9em;">
 * <b>Transaction Status Stream.</b><br>
 * Lazy, single-pass sequence of statuses for one submission. Not restartable: a retry needs a new submission.
 * The transport produces through {@link #publish(TxStatus)} / {@link #end()};
 * the watcher consumes through {@link #next(Duration)}, its only suspension point.
 * Closing cancels observation only; it never rolls back an effect already applied on the ledger.
 * </span>
 *
 * @author vevoly
 * @since 1.0.0
 */
@Slf4j
public final class TxStatusStream implements AutoCloseable {

    // 流结束标记 / End-of-stream marker
    private static final Object END = new Object();

    private final String txHash;
    private final BlockingQueue<Object> queue = new LinkedBlockingQueue<>();
    private final AtomicBoolean ended = new AtomicBoolean(false);
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private volatile Runnable cancelHandler;

    // 仅消费线程访问 / consumer thread only
    private boolean exhausted;

    public TxStatusStream(String txHash) {
        this.txHash = txHash;
    }

    /**
     * 创建一个只含单个终态的流 (A stream holding a single terminal status).
     * <p>用于准入阶段即被拒绝的提交。</p>
     */
    public static TxStatusStream rejected(String txHash, TxStatus terminal) {
        TxStatusStream stream = new TxStatusStream(txHash);
        stream.publish(terminal);
        return stream;
    }

    public String getTxHash() {
        return txHash;
    }

    // ---------------------------------------------------------------- 生产方 / producer side

    /**
     * 推送状态 (Publish a status). 终态会自动结束流 / a terminal status ends the stream.
     *
     * @return false 表示流已结束或已取消，状态被丢弃 / false when ended or cancelled and the status was discarded
     */
    public boolean publish(TxStatus status) {
        if (ended.get() || cancelled.get()) {
            return false;
        }
        queue.add(status);
        if (status.isTerminal()) {
            end();
        }
        return true;
    }

    /**
     * 结束流，不附带终态 (End without a terminal status, e.g. transport closed).
     */
    public void end() {
        if (ended.compareAndSet(false, true)) {
            queue.add(END);
        }
    }

    /**
     * 注册取消回调 (Register the producer's cancel hook). 若已取消则立即执行 / runs at once if already cancelled.
     */
    public void onCancel(Runnable handler) {
        this.cancelHandler = handler;
        if (cancelled.get()) {
            handler.run();
        }
    }

    public boolean isEnded() {
        return ended.get();
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    // ---------------------------------------------------------------- 消费方 / consumer side

    /**
     * 获取下一个状态 (Next status).
     *
     * @param timeout 最长等待时间 (Maximum wait)
     * @return 状态；流已结束时为空 / the status, or empty once the stream has ended
     * @throws TimeoutException     超时未收到任何状态 / nothing arrived within the timeout
     * @throws InterruptedException 等待被中断 / interrupted while waiting
     */
    public Optional<TxStatus> next(Duration timeout) throws InterruptedException, TimeoutException {
        if (exhausted) {
            return Optional.empty();
        }
        Object item = queue.poll(timeout.toNanos(), TimeUnit.NANOSECONDS);
        if (item == null) {
            throw new TimeoutException("No status for tx " + txHash + " within " + timeout);
        }
        if (item == END) {
            exhausted = true;
            return Optional.empty();
        }
        TxStatus status = (TxStatus) item;
        if (status.isTerminal()) {
            exhausted = true;
        }
        return Optional.of(status);
    }

    /**
     * 取消观察 (Cancel observation). 幂等 / idempotent.
     */
    @Override
    public void close() {
        if (cancelled.compareAndSet(false, true)) {
            end();
            Runnable handler = this.cancelHandler;
            if (handler != null) {
                try {
                    handler.run();
                } catch (RuntimeException e) {
                    log.warn("Cancel handler of tx {} failed", txHash, e);
                }
            }
        }
    }
}
