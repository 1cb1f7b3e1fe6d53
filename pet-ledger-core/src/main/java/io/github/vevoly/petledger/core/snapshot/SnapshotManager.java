package io.github.vevoly.petledger.core.snapshot;

import com.esotericsoftware.kryo.Kryo;
import com.esotericsoftware.kryo.io.Input;
import com.esotericsoftware.kryo.io.Output;
import com.esotericsoftware.kryo.serializers.JavaSerializer;
import com.esotericsoftware.kryo.util.DefaultInstantiatorStrategy;
import com.google.common.hash.BloomFilter;
import io.github.vevoly.petledger.api.IdempotencyStrategy;
import io.github.vevoly.petledger.api.constants.PetLedgerConstant;
import io.github.vevoly.petledger.api.exception.PetLedgerErrorCode;
import io.github.vevoly.petledger.api.exception.PetLedgerException;
import io.github.vevoly.petledger.api.tx.BlockRef;
import io.github.vevoly.petledger.core.idempotency.LruIdempotencyStrategy;
import lombok.extern.slf4j.Slf4j;
import org.objenesis.strategy.StdInstantiatorStrategy;

import java.io.File;
import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.Serializable;
import java.nio.file.Files;
import java.nio.file.StandardCopyOption;

/**
 * <h3>快照管理器 (Snapshot Manager)</h3>
 *
 * <p>
 * 负责账本状态的序列化与持久化。采用 <b>Kryo</b> 进行序列化，并使用 <b>原子文件操作</b> 保证数据的完整性：
 * 先写临时文件，再原子重命名，写入中断不会破坏上一份快照。
 * </p>
 *
 * <hr>
 *
 * <span style="color: gray; font-size: 0.9em;">
 * <b>Snapshot Manager.</b><br>
 * Serializes and persists the ledger state with <b>Kryo</b>. Writes go to a temp file followed by an
 * <b>atomic move</b>, so an interrupted write never damages the previous snapshot.
 * </span>
 *
 * @param <S> 状态类型 (State Type)
 * @author vevoly
 * @since 1.0.0
 */
@Slf4j
public class SnapshotManager<S extends Serializable> {

    private static final String SNAPSHOT_FILE_NAME = "snapshot.dat";
    private static final String TEMP_FILE_NAME = "snapshot.tmp";

    private final File snapshotDir;
    private final Class<S> stateClass;

    /**
     * 构造函数 (Constructor).
     *
     * @param dataDir    节点数据目录 (Node data directory)
     * @param stateClass 状态类型，用于加载时校验 / state type, checked on load
     */
    public SnapshotManager(String dataDir, Class<S> stateClass) {
        this.snapshotDir = new File(dataDir, PetLedgerConstant.SNAPSHOT_DIR);
        this.stateClass = stateClass;
        if (!this.snapshotDir.exists() && !this.snapshotDir.mkdirs()) {
            log.warn("快照目录创建失败 / Failed to create snapshot dir: {}", snapshotDir.getAbsolutePath());
        }
    }

    /**
     * 执行快照保存 (原子写入).
     *
     * <hr>
     * <span style="color: gray; font-size: 0.9em;">
     * <b>Execute Snapshot Saving (Atomic Write).</b>
     * </span>
     *
     * @param head       当前链头 (Current chain head)
     * @param state      账本状态 (Ledger State)
     * @param strategy   去重策略 (Deduplication Strategy)
     * @param logContext 日志上下文 (Log context)
     * @throws PetLedgerException {@code SNAPSHOT_SAVE_FAILED} 写入或重命名失败 / write or rename failed
     */
    public void save(BlockRef head, S state, IdempotencyStrategy strategy, String logContext) throws PetLedgerException {
        File tempFile = new File(snapshotDir, TEMP_FILE_NAME);
        File finalFile = new File(snapshotDir, SNAPSHOT_FILE_NAME);
        Kryo kryo = createKryo();

        // 1. 写入临时文件 / Write to temporary file
        try (Output output = new Output(new FileOutputStream(tempFile))) {
            SnapshotContainer<S> container = new SnapshotContainer<>(head.getHeight(), head.getHash(), state, strategy);
            kryo.writeObject(output, container);
            output.flush();
        } catch (IOException | RuntimeException e) {
            throw new PetLedgerException(PetLedgerErrorCode.SNAPSHOT_SAVE_FAILED,
                    "Failed to write snapshot to temp file " + tempFile, e);
        }

        // 2. 原子重命名 / Atomic move
        try {
            Files.move(tempFile.toPath(), finalFile.toPath(), StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            log.info("{} 快照保存成功 / Snapshot saved. Head: {}", logContext, head);
        } catch (IOException e) {
            throw new PetLedgerException(PetLedgerErrorCode.SNAPSHOT_SAVE_FAILED,
                    "Failed to move snapshot into place " + finalFile, e);
        }
    }

    /**
     * 加载快照.
     *
     * <hr>
     * <span style="color: gray; font-size: 0.9em;">
     * <b>Load Snapshot.</b>
     * </span>
     *
     * @return 快照容器对象，不存在则返回 null (Snapshot container, or null if none exists)
     * @throws PetLedgerException {@code SNAPSHOT_LOAD_FAILED} 文件损坏或版本不兼容 / corrupted or incompatible file
     */
    @SuppressWarnings("unchecked")
    public SnapshotContainer<S> load() throws PetLedgerException {
        File file = new File(snapshotDir, SNAPSHOT_FILE_NAME);
        if (!file.exists()) {
            log.info("未发现快照文件，从创世状态开始。/ No snapshot found, starting from genesis.");
            return null;
        }

        Kryo kryo = createKryo();
        try (Input input = new Input(new FileInputStream(file))) {
            log.info("发现快照文件，正在加载... / Snapshot found, loading...");
            SnapshotContainer<S> container = kryo.readObject(input, SnapshotContainer.class);
            if (container.getState() != null && !stateClass.isInstance(container.getState())) {
                throw new IllegalStateException("Unexpected state type " + container.getState().getClass().getName());
            }
            return container;
        } catch (IOException | RuntimeException e) {
            throw new PetLedgerException(PetLedgerErrorCode.SNAPSHOT_LOAD_FAILED,
                    "Snapshot file corrupted or incompatible: " + file, e);
        }
    }

    /**
     * 创建 Kryo 实例 (非线程安全，每次创建新的) / Create Kryo instance (Not thread-safe, create new each time)
     */
    private Kryo createKryo() {
        Kryo kryo = new Kryo();
        kryo.setRegistrationRequired(false); // 允许未注册的类 / Allow unregistered classes
        kryo.setReferences(true);
        // 值对象没有公开无参构造 / value objects have no public no-arg constructor
        kryo.setInstantiatorStrategy(new DefaultInstantiatorStrategy(new StdInstantiatorStrategy()));
        // BloomFilter 与 LRU Map 使用自身的 Java 序列化逻辑 / use their own Java serialization
        kryo.register(BloomFilter.class, new JavaSerializer());
        kryo.register(LruIdempotencyStrategy.LruHashMap.class, new JavaSerializer());
        return kryo;
    }
}
