package io.github.vevoly.petledger.core.node;

import com.google.common.hash.Hasher;
import com.google.common.hash.Hashing;
import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.EventHandler;
import com.lmax.disruptor.InsufficientCapacityException;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import io.github.vevoly.petledger.api.IdempotencyStrategy;
import io.github.vevoly.petledger.api.LedgerTransport;
import io.github.vevoly.petledger.api.codec.CommandCodec;
import io.github.vevoly.petledger.api.command.CommandType;
import io.github.vevoly.petledger.api.constants.PetLedgerConstant;
import io.github.vevoly.petledger.api.crypto.Ed25519;
import io.github.vevoly.petledger.api.crypto.SignatureVerifier;
import io.github.vevoly.petledger.api.event.EventRecord;
import io.github.vevoly.petledger.api.exception.InitializationException;
import io.github.vevoly.petledger.api.exception.PetLedgerErrorCode;
import io.github.vevoly.petledger.api.exception.PetLedgerException;
import io.github.vevoly.petledger.api.exception.PetNameTooLongException;
import io.github.vevoly.petledger.api.exception.UnknownBlockException;
import io.github.vevoly.petledger.api.model.AccountId;
import io.github.vevoly.petledger.api.model.PetRecord;
import io.github.vevoly.petledger.api.tx.BlockRef;
import io.github.vevoly.petledger.api.tx.SignedCommand;
import io.github.vevoly.petledger.api.tx.TxReceipt;
import io.github.vevoly.petledger.api.tx.TxStatus;
import io.github.vevoly.petledger.api.tx.TxStatusStream;
import io.github.vevoly.petledger.core.PetLedger;
import io.github.vevoly.petledger.core.clock.BlockHeightClock;
import io.github.vevoly.petledger.core.dispatch.PetCommandDispatcher;
import io.github.vevoly.petledger.core.event.EventLog;
import io.github.vevoly.petledger.core.idempotency.LruIdempotencyStrategy;
import io.github.vevoly.petledger.core.metrics.LedgerMetricManager;
import io.github.vevoly.petledger.core.snapshot.SnapshotContainer;
import io.github.vevoly.petledger.core.snapshot.SnapshotManager;
import io.github.vevoly.petledger.core.store.InMemoryLedgerStore;
import io.github.vevoly.petledger.core.store.PetLedgerState;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import lombok.Data;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * <h3>宠物账本节点 (Pet Ledger Node)</h3>
 *
 * <p>
 * 单节点、单一权威状态机形式的账本传输层。所有交易由唯一的 Disruptor 线程按到达顺序执行，
 * 因此同一账户的命令天然串行，所有权不变量无需额外协调。
 * </p>
 *
 * <h3>交易生命周期 (Transaction Lifecycle):</h3>
 * <pre>
 * submit (调用线程 / caller thread)
 *   ├─ 节点未运行 / not running        → ERROR
 *   ├─ 签名或载荷不符 / bad signature    → INVALID
 *   ├─ 名称超长 / name too long         → INVALID
 *   ├─ 重复交易 / duplicate tx hash     → INVALID
 *   ├─ 交易池已满 / ring buffer full    → DROPPED
 *   └─ READY → RingBuffer
 * Disruptor 线程 / consumer thread
 *   ├─ 执行命令，记录回执 (失败也会被打包) / dispatch, record receipt (failures are included too)
 *   └─ SEAL 信号 → IN_BLOCK(ref) → height &lt;= head - finalityDepth 时 FINALIZED(ref)
 * </pre>
 *
 * <hr>
 *
 * <span style="color: gray; font-size: 0.9em;">
 * <b>Pet Ledger Node.</b><br>
 * Ledger transport built as a single authoritative state machine. Every transaction runs on one Disruptor
 * thread in arrival order, so commands touching the same account are serialized by construction.<br>
 * Blocks are sealed by a SEAL signal on the ring buffer, either on a fixed interval or on demand through
 * {@link #produceBlock()}. A block is final once {@code finalityDepth} further blocks were sealed on top of it.
 * </span>
 *
 * @author vevoly
 * @since 1.0.0
 */
@Slf4j
public class PetLedgerNode implements LedgerTransport {

    // --- 核心组件 (Core Components) ---
    private final InMemoryLedgerStore store;
    private final BlockHeightClock clock;
    @Getter
    private final EventLog eventLog;
    @Getter
    private final PetLedger ledger;
    private final CommandCodec codec;
    private final SignatureVerifier verifier;
    private final SnapshotManager<PetLedgerState> snapshotManager; // 未配置 baseDir 时为 null / null without baseDir
    private IdempotencyStrategy idempotencyStrategy;
    private Disruptor<EventWrapper> disruptor;

    // --- 配置 (Configuration) ---
    @Getter
    private final String nodeName;
    private final Duration blockInterval;
    private final int finalityDepth;
    private final int ringBufferSize;
    private final int snapshotInterval;

    // --- 运行时状态 (Runtime State) ---
    private volatile boolean running;
    private volatile boolean stopped;
    private volatile BlockRef head = new BlockRef(PetLedgerConstant.GENESIS_HEIGHT, PetLedgerConstant.GENESIS_HASH);
    private final Object admissionLock = new Object(); // 保护 running 与去重策略 / guards running and the dedup strategy
    private final Set<TxStatusStream> openStreams = ConcurrentHashMap.newKeySet();
    private final ConcurrentMap<Long, SealedBlock> blocks = new ConcurrentHashMap<>();

    // --- 仅 Disruptor 线程访问 (Consumer thread only) ---
    private List<PendingTx> building = new ArrayList<>();
    private final Deque<SealedBlock> unfinalized = new ArrayDeque<>();
    private int blocksSinceSnapshot = 0;

    // --- 监控 (Metrics) ---
    private final MeterRegistry registry;
    private final LedgerMetricManager metricManager;
    private final Tags tags;
    private final Map<CommandType, Timer> dispatchTimers = new EnumMap<>(CommandType.class);
    private final Map<CommandType, Counter> appliedCounters = new EnumMap<>(CommandType.class);
    private final Map<CommandType, Counter> failedCounters = new EnumMap<>(CommandType.class);
    private final Counter sealedCounter;

    // --- 出块调度 (Block Scheduler) ---
    private ScheduledExecutorService blockScheduler;

    // 内部事件包装器：交易或封块信号，二选一 / internal event wrapper: either a transaction or a seal signal
    private static class EventWrapper {
        PendingTx tx;
        CompletableFuture<BlockRef> seal;
    }

    private static class PendingTx {
        final SignedCommand envelope;
        final TxStatusStream stream;
        TxReceipt receipt;

        PendingTx(SignedCommand envelope, TxStatusStream stream) {
            this.envelope = envelope;
            this.stream = stream;
        }
    }

    private static class SealedBlock {
        final BlockRef ref;
        final Map<String, TxReceipt> receipts;
        List<PendingTx> txs; // 最终确认后释放 / released once final

        SealedBlock(BlockRef ref, Map<String, TxReceipt> receipts, List<PendingTx> txs) {
            this.ref = ref;
            this.receipts = receipts;
            this.txs = txs;
        }
    }

    private PetLedgerNode(Builder builder) {
        this.nodeName = builder.getNodeName();
        this.blockInterval = builder.getBlockInterval();
        this.finalityDepth = builder.getFinalityDepth();
        this.ringBufferSize = builder.getRingBufferSize();
        this.snapshotInterval = builder.getSnapshotInterval();
        this.codec = new CommandCodec(builder.getMaxNameLength());
        this.verifier = builder.getVerifier();

        // 1. 组装账本 / assemble the ledger
        this.store = new InMemoryLedgerStore();
        this.clock = new BlockHeightClock();
        this.eventLog = builder.getEventLog() != null ? builder.getEventLog() : new EventLog();
        this.ledger = new PetLedger(store, new PetCommandDispatcher(), clock, eventLog, builder.getLockStripes());

        // 2. 快照目录 格式 / snapshot path: baseDir/nodeName/snapshot
        this.snapshotManager = builder.getBaseDir() == null ? null :
                new SnapshotManager<>(builder.getBaseDir() + File.separator + nodeName, PetLedgerState.class);

        // 3. 去重策略 (默认 LRU) / dedup strategy (default LRU)
        this.idempotencyStrategy = builder.getIdempotencyStrategy() != null ?
                builder.getIdempotencyStrategy() :
                new LruIdempotencyStrategy();

        // 4. Metrics
        this.registry = builder.getRegistry();
        this.metricManager = new LedgerMetricManager(builder.getMetricsPrefix());
        this.tags = Tags.of(LedgerMetricManager.TAG_NODE, nodeName);
        for (CommandType type : CommandType.values()) {
            Tags typeTags = tags.and(LedgerMetricManager.TAG_COMMAND, type.name());
            dispatchTimers.put(type, Timer.builder(metricManager.dispatchTime).tags(typeTags).register(registry));
            appliedCounters.put(type, Counter.builder(metricManager.commandsApplied).tags(typeTags).register(registry));
            failedCounters.put(type, Counter.builder(metricManager.commandsFailed).tags(typeTags).register(registry));
        }
        this.sealedCounter = Counter.builder(metricManager.blocksSealed).tags(tags).register(registry);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * 启动节点 (Start Node).
     * <ol>
     *     <li>恢复快照 (Restore the snapshot, if any).</li>
     *     <li>启动 Disruptor (Start Disruptor).</li>
     *     <li>启动出块定时器 (Start the block timer, unless the interval is zero).</li>
     * </ol>
     *
     * @throws InitializationException 快照无法加载或节点已停止 / snapshot unreadable or node already stopped
     */
    public synchronized void start() throws InitializationException {
        if (running) {
            log.warn("节点 [{}] 已在运行 / Node is already running", nodeName);
            return;
        }
        if (stopped) {
            throw new InitializationException("Node " + nodeName + " was shut down and cannot be restarted");
        }
        log.info(">>> 节点 [{}] 正在启动...", nodeName);

        // 1. 恢复 / recover
        recover();

        // 2. 配置并启动 Disruptor / Configure and start Disruptor
        this.disruptor = new Disruptor<>(
                EventWrapper::new,
                ringBufferSize,
                r -> {
                    Thread t = new Thread(r);
                    t.setName("PetLedger-" + nodeName);
                    t.setDaemon(true);
                    return t;
                },
                ProducerType.MULTI,
                new BlockingWaitStrategy()
        );
        // 剩余容量，越小越危险 / remaining capacity, the smaller the more dangerous
        registry.gauge(metricManager.ringRemaining, tags, disruptor, d -> d.getRingBuffer().remainingCapacity());
        this.disruptor.handleEventsWith(new NodeEventHandler());
        this.disruptor.start();

        synchronized (admissionLock) {
            running = true;
        }

        // 3. 出块定时器 / block timer
        if (!blockInterval.isZero()) {
            this.blockScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
                Thread t = new Thread(r, "PetLedger-Block-" + nodeName);
                t.setDaemon(true);
                return t;
            });
            long intervalMs = blockInterval.toMillis();
            this.blockScheduler.scheduleAtFixedRate(this::requestSeal, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        }
        log.info("<<< 节点 [{}] 启动成功！链头: {}, 出块间隔: {}, 最终确认深度: {}",
                nodeName, head, blockInterval.isZero() ? "manual" : blockInterval, finalityDepth);
    }

    private void recover() throws InitializationException {
        if (snapshotManager == null) {
            log.info("节点 [{}] 未配置数据目录，状态仅保存在内存中。/ No base dir, state is memory only.", nodeName);
            return;
        }
        try {
            SnapshotContainer<PetLedgerState> snapshot = snapshotManager.load();
            if (snapshot == null) {
                return;
            }
            store.load(snapshot.getState());
            if (snapshot.getIdempotencyStrategy() != null) {
                this.idempotencyStrategy = snapshot.getIdempotencyStrategy();
            }
            this.head = snapshot.getHead();
            clock.advanceTo(head.getHeight() + 1);
            log.info("节点 [{}] 已加载快照，链头: {}, 持有者数: {}", nodeName, head, store.size());
        } catch (PetLedgerException e) {
            throw new InitializationException("Failed to restore node " + nodeName, e);
        }
    }

    /**
     * <h3>提交签名交易 (Submit Signed Transaction)</h3>
     *
     * <p>
     * 准入检查在调用线程上完成，被拒绝的交易直接得到只含终态的状态流；
     * 通过检查的交易获得 READY 并以零拷贝方式发布到 RingBuffer。此方法不会抛出异常。
     * </p>
     *
     * <hr>
     *
     * <span style="color: gray; font-size: 0.9em;">
     * <b>Submit a Signed Transaction.</b><br>
     * Admission runs on the caller thread; a rejected transaction gets a stream holding only its terminal status.
     * An admitted one gets READY and is published to the ring buffer. Never throws.
     * </span>
     */
    @Override
    public TxStatusStream submit(SignedCommand envelope) {
        String txHash = envelope.getTxHash();
        if (!running) {
            return TxStatusStream.rejected(txHash, TxStatus.error("Node " + nodeName + " is not running"));
        }

        // 1. 载荷必须是命令的规范编码，且哈希与签名都匹配 / payload must be canonical, hash and signature must match
        byte[] expected;
        try {
            expected = codec.encodePayload(envelope.getSigner(), envelope.getTxId(), envelope.getCommand());
        } catch (PetNameTooLongException e) {
            return reject(txHash, TxStatus.invalid(reason(e.getErrorCode(), e.getMessage())));
        } catch (RuntimeException e) {
            // 信封字段缺失或非法 / malformed envelope fields
            return reject(txHash, TxStatus.invalid(reason(PetLedgerErrorCode.INVALID_ARGUMENT, String.valueOf(e.getMessage()))));
        }
        byte[] payload = envelope.getPayload();
        if (!Arrays.equals(expected, payload)
                || !CommandCodec.hash(expected).equals(txHash)
                || !verifier.verify(envelope.getSigner(), payload, envelope.getSignature())) {
            PetLedgerErrorCode code = PetLedgerErrorCode.INVALID_SIGNATURE;
            return reject(txHash, TxStatus.invalid(reason(code, code.getDefaultMessage())));
        }

        TxStatusStream stream = new TxStatusStream(txHash);
        synchronized (admissionLock) {
            if (!running) {
                return TxStatusStream.rejected(txHash, TxStatus.error("Node " + nodeName + " is not running"));
            }
            // 2. 去重 / dedup
            if (idempotencyStrategy.contains(txHash)) {
                PetLedgerErrorCode code = PetLedgerErrorCode.DUPLICATE_TRANSACTION;
                return reject(txHash, TxStatus.invalid(reason(code, code.getDefaultMessage() + ": " + txHash)));
            }
            // 3. 领号，失败说明交易池已满 / claim a slot; failure means the pool is full
            RingBuffer<EventWrapper> ringBuffer = disruptor.getRingBuffer();
            long sequence;
            try {
                sequence = ringBuffer.tryNext();
            } catch (InsufficientCapacityException e) {
                log.warn("节点 [{}] 交易池已满，丢弃交易 {}", nodeName, txHash);
                return TxStatusStream.rejected(txHash, TxStatus.dropped("Pending pool is full"));
            }
            try {
                idempotencyStrategy.add(txHash);
                openStreams.add(stream);
                stream.onCancel(() -> openStreams.remove(stream));
                stream.publish(TxStatus.ready());
                ringBuffer.get(sequence).tx = new PendingTx(envelope, stream);
            } finally {
                ringBuffer.publish(sequence);
            }
        }
        return stream;
    }

    private TxStatusStream reject(String txHash, TxStatus terminal) {
        log.debug("节点 [{}] 拒绝交易 {}: {} {}", nodeName, txHash, terminal.getKind(), terminal.getDetail());
        return TxStatusStream.rejected(txHash, terminal);
    }

    private static String reason(PetLedgerErrorCode code, String message) {
        return code.name() + ": " + message;
    }

    /**
     * <h3>立即封块 (Produce a Block Now)</h3>
     *
     * <p>向 RingBuffer 发布封块信号，排在它之前的交易都会进入该区块。出块间隔为 0 时这是唯一的出块方式。</p>
     *
     * <hr>
     * <span style="color: gray; font-size: 0.9em;">
     * Publishes a seal signal; every transaction ahead of it lands in the block.
     * The only way blocks are produced when the block interval is zero.
     * </span>
     *
     * @return 封块完成后得到区块引用 (Completes with the sealed block's ref)
     */
    public CompletableFuture<BlockRef> produceBlock() {
        CompletableFuture<BlockRef> future = new CompletableFuture<>();
        synchronized (admissionLock) {
            if (!running) {
                future.completeExceptionally(new IllegalStateException("Node " + nodeName + " is not running"));
                return future;
            }
            RingBuffer<EventWrapper> ringBuffer = disruptor.getRingBuffer();
            long sequence;
            try {
                sequence = ringBuffer.tryNext();
            } catch (InsufficientCapacityException e) {
                future.completeExceptionally(new IllegalStateException("Ring buffer of node " + nodeName + " is full", e));
                return future;
            }
            try {
                ringBuffer.get(sequence).seal = future;
            } finally {
                ringBuffer.publish(sequence);
            }
        }
        return future;
    }

    private void requestSeal() {
        produceBlock().whenComplete((ref, error) -> {
            if (error != null) {
                log.warn("节点 [{}] 定时出块失败 / Scheduled block failed: {}", nodeName, error.getMessage());
            }
        });
    }

    /**
     * 内部 Disruptor 处理器 (Internal Disruptor Handler).
     */
    private class NodeEventHandler implements EventHandler<EventWrapper> {
        @Override
        public void onEvent(EventWrapper event, long sequence, boolean endOfBatch) {
            PendingTx tx = event.tx;
            CompletableFuture<BlockRef> seal = event.seal;
            // 清理引用，帮助 GC / Clean up references to help GC
            event.tx = null;
            event.seal = null;
            try {
                if (seal != null) {
                    seal.complete(sealBlock());
                } else if (tx != null) {
                    execute(tx);
                }
            } catch (Throwable t) {
                // 捕获 Throwable，防止 Disruptor 线程终止 / Catch Throwable so the Disruptor thread survives
                log.error("节点 [{}] 处理事件时发生严重错误，Sequence: {}", nodeName, sequence, t);
                if (tx != null) {
                    tx.stream.publish(TxStatus.error("Internal node error: " + t.getMessage()));
                    openStreams.remove(tx.stream);
                }
                if (seal != null) {
                    seal.completeExceptionally(t);
                }
            }
        }
    }

    /**
     * 执行一笔交易 (Execute one transaction). 调度失败也会被打包，错误码写入回执。
     */
    private void execute(PendingTx tx) {
        SignedCommand envelope = tx.envelope;
        CommandType type = envelope.getCommand().getType();
        int txIndex = building.size();
        long height = clock.currentHeight();
        Timer.Sample sample = Timer.start(registry);
        try {
            ledger.apply(envelope.getSigner(), envelope.getCommand(), txIndex, envelope.getTxHash());
            tx.receipt = TxReceipt.success(envelope.getTxHash(), txIndex, height);
            appliedCounters.get(type).increment();
        } catch (PetLedgerException e) {
            tx.receipt = TxReceipt.failure(envelope.getTxHash(), txIndex, height, e.getErrorCode());
            failedCounters.get(type).increment();
            log.debug("Tx {} ({}) failed at #{}: {}", envelope.getTxHash(), type, height, e.getMessage());
        } finally {
            sample.stop(dispatchTimers.get(type));
        }
        building.add(tx);
    }

    /**
     * 封块 (Seal the building block), 并推进最终确认 / then advance finality.
     */
    private BlockRef sealBlock() {
        long height = clock.currentHeight();
        List<PendingTx> txs = building;
        building = new ArrayList<>();

        Hasher hasher = Hashing.sha256().newHasher()
                .putString(head.getHash(), StandardCharsets.UTF_8)
                .putLong(height);
        Map<String, TxReceipt> receipts = new LinkedHashMap<>();
        for (PendingTx tx : txs) {
            hasher.putString(tx.envelope.getTxHash(), StandardCharsets.UTF_8);
            receipts.put(tx.envelope.getTxHash(), tx.receipt);
        }
        BlockRef ref = new BlockRef(height, hasher.hash().toString());
        SealedBlock block = new SealedBlock(ref, Collections.unmodifiableMap(receipts), txs);
        blocks.put(height, block);
        unfinalized.addLast(block);
        head = ref;
        clock.advance();
        sealedCounter.increment();

        for (PendingTx tx : txs) {
            tx.stream.publish(TxStatus.inBlock(ref));
        }
        log.debug("节点 [{}] 封块 {}, 交易数: {}", nodeName, ref, txs.size());

        finalizeUpTo(height - finalityDepth);

        // 数量触发快照 / count-triggered snapshot
        blocksSinceSnapshot++;
        if (snapshotManager != null && snapshotInterval > 0 && blocksSinceSnapshot >= snapshotInterval) {
            doSnapshot("CountTrigger");
        }
        return ref;
    }

    private void finalizeUpTo(long height) {
        while (!unfinalized.isEmpty() && unfinalized.peekFirst().ref.getHeight() <= height) {
            SealedBlock block = unfinalized.pollFirst();
            for (PendingTx tx : block.txs) {
                tx.stream.publish(TxStatus.finalized(block.ref));
                openStreams.remove(tx.stream);
            }
            block.txs = Collections.emptyList();
            log.debug("节点 [{}] 区块已最终确认 / Block finalized: {}", nodeName, block.ref);
        }
    }

    private void doSnapshot(String reason) {
        // 组装日志上下文：[节点名][原因] / Build log context: [node name][reason]
        String logContext = String.format("[%s][%s]", nodeName, reason);
        try {
            synchronized (admissionLock) {
                snapshotManager.save(head, store.getState(), idempotencyStrategy, logContext);
            }
            blocksSinceSnapshot = 0;
        } catch (PetLedgerException e) {
            log.error("{} 快照保存失败 / Snapshot failed", logContext, e);
        }
    }

    @Override
    public List<EventRecord> fetchEvents(BlockRef block) throws UnknownBlockException {
        requireKnown(block);
        return eventLog.eventsAt(block.getHeight());
    }

    @Override
    public Optional<TxReceipt> fetchReceipt(BlockRef block, String txHash) throws UnknownBlockException {
        SealedBlock sealed = requireKnown(block);
        return Optional.ofNullable(sealed.receipts.get(txHash));
    }

    private SealedBlock requireKnown(BlockRef block) throws UnknownBlockException {
        SealedBlock sealed = blocks.get(block.getHeight());
        if (sealed == null || !sealed.ref.equals(block)) {
            throw new UnknownBlockException(block);
        }
        return sealed;
    }

    @Override
    public Optional<PetRecord> petOf(AccountId account) {
        return ledger.petOf(account);
    }

    @Override
    public long lastFeedTime(long petId) {
        return ledger.lastFeedTime(petId);
    }

    @Override
    public OptionalLong lastSleepTime(long petId) {
        return ledger.lastSleepTime(petId);
    }

    /**
     * 当前链头 (Current chain head).
     */
    public BlockRef getHead() {
        return head;
    }

    /**
     * 正在构建的区块高度 (Height of the block being built).
     */
    public long currentHeight() {
        return clock.currentHeight();
    }

    public boolean isRunning() {
        return running;
    }

    public String getIdempotencyStrategyName() {
        return idempotencyStrategy.getName();
    }

    /**
     * <h3>优雅停机 (Graceful Shutdown)</h3>
     *
     * <ol>
     *     <li><b>Stop admission:</b> 新提交得到 ERROR，停止出块定时器。</li>
     *     <li><b>Stop Disruptor:</b> 处理完 RingBuffer 中剩余的积压。</li>
     *     <li><b>End streams:</b> 未到终态的状态流直接结束，调用方得到不确定结果，需要重新查询。</li>
     *     <li><b>Force Snapshot:</b> 配置了数据目录时保存最终快照。</li>
     * </ol>
     *
     * <hr>
     *
     * <span style="color: gray; font-size: 0.9em;">
     * <b>Graceful Shutdown.</b><br>
     * 1. Stop admission and the block timer.<br>
     * 2. Stop Disruptor (process remaining events).<br>
     * 3. End open streams without a terminal status; callers see an indeterminate outcome.<br>
     * 4. Force a final snapshot when a base dir is configured.
     * </span>
     */
    public synchronized void shutdown() {
        if (!running) {
            return;
        }
        log.info(">>> 节点 [{}] 正在停止...", nodeName);
        // 1. 停止准入与出块 / Stop admission and block production
        synchronized (admissionLock) {
            running = false;
            stopped = true;
        }
        if (blockScheduler != null) {
            blockScheduler.shutdownNow();
        }
        // 2. 停止 Disruptor / Stop Disruptor
        disruptor.shutdown();
        // 3. 结束未完成的状态流 / End open streams
        int open = openStreams.size();
        for (TxStatusStream stream : openStreams) {
            stream.end();
        }
        openStreams.clear();
        // 4. 停机快照 / Shutdown snapshot
        if (snapshotManager != null) {
            log.info("[{}][Shutdown] 执行停机快照...", nodeName);
            doSnapshot("Shutdown");
        }
        log.info("<<< 节点 [{}] 已安全停止。结束的状态流: {}", nodeName, open);
    }

    /**
     * 节点构建器 (Node Builder).
     */
    @Data
    public static class Builder {
        // 基础配置 / Base Configuration
        private String nodeName = PetLedgerConstant.DEFAULT_NODE_NAME;
        private String baseDir; // null = 不做快照 / no snapshots
        private int maxNameLength = PetLedgerConstant.DEFAULT_MAX_NAME_LENGTH;
        // 出块配置 / Block Configuration
        private Duration blockInterval = PetLedgerConstant.DEFAULT_BLOCK_INTERVAL;
        private int finalityDepth = PetLedgerConstant.DEFAULT_FINALITY_DEPTH;
        // 性能配置 / Performance Configuration
        private int ringBufferSize = PetLedgerConstant.DEFAULT_RING_BUFFER_SIZE;
        private int snapshotInterval = PetLedgerConstant.DEFAULT_SNAPSHOT_INTERVAL;
        private int lockStripes = PetLedgerConstant.DEFAULT_LOCK_STRIPES;
        // Metrics
        private MeterRegistry meterRegistry;
        private String metricsPrefix = PetLedgerConstant.DEFAULT_METRICS_PREFIX;
        // 用户扩展点 / User Extensions
        private IdempotencyStrategy idempotencyStrategy;
        private SignatureVerifier verifier = Ed25519.verifier();
        private EventLog eventLog;

        public Builder name(String name) {
            this.nodeName = name;
            return this;
        }
        public Builder baseDir(String dir) {
            this.baseDir = dir;
            return this;
        }
        public Builder maxNameLength(int length) {
            this.maxNameLength = length;
            return this;
        }
        public Builder blockInterval(Duration interval) {
            this.blockInterval = interval;
            return this;
        }
        public Builder finalityDepth(int depth) {
            this.finalityDepth = depth;
            return this;
        }
        public Builder ringBufferSize(int size) {
            this.ringBufferSize = size;
            return this;
        }
        public Builder snapshotInterval(int interval) {
            this.snapshotInterval = interval;
            return this;
        }
        public Builder lockStripes(int stripes) {
            this.lockStripes = stripes;
            return this;
        }
        public Builder meterRegistry(MeterRegistry registry) {
            this.meterRegistry = registry;
            return this;
        }
        public Builder metricsPrefix(String prefix) {
            this.metricsPrefix = prefix;
            return this;
        }
        public Builder idempotency(IdempotencyStrategy strategy) {
            this.idempotencyStrategy = strategy;
            return this;
        }
        public Builder verifier(SignatureVerifier verifier) {
            this.verifier = verifier;
            return this;
        }
        public Builder eventLog(EventLog eventLog) {
            this.eventLog = eventLog;
            return this;
        }

        /**
         * 获取监控注册表 (Get Registry).
         * <p>兜底逻辑：如果用户没传，返回 SimpleMeterRegistry 防止空指针。</p>
         */
        public MeterRegistry getRegistry() {
            if (this.meterRegistry == null) {
                this.meterRegistry = new SimpleMeterRegistry();
            }
            return this.meterRegistry;
        }

        public PetLedgerNode build() {
            if (nodeName == null || nodeName.isBlank()) {
                throw new IllegalArgumentException("Node name is required.");
            }
            if (blockInterval == null || blockInterval.isNegative()) {
                throw new IllegalArgumentException("Block interval must be zero (manual) or positive.");
            }
            if (!blockInterval.isZero() && blockInterval.toMillis() == 0) {
                throw new IllegalArgumentException("Block interval must be at least 1ms.");
            }
            if (finalityDepth < 0) {
                throw new IllegalArgumentException("Finality depth must not be negative.");
            }
            if (ringBufferSize <= 0 || Integer.bitCount(ringBufferSize) != 1) {
                throw new IllegalArgumentException("Ring buffer size must be a power of 2.");
            }
            if (snapshotInterval < 0) {
                throw new IllegalArgumentException("Snapshot interval must not be negative.");
            }
            if (verifier == null) {
                throw new IllegalArgumentException("Signature verifier is required.");
            }
            return new PetLedgerNode(this);
        }
    }
}
