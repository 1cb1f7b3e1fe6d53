package io.github.vevoly.petledger.starter;

import io.github.vevoly.petledger.api.constants.PetLedgerConstant;
import io.github.vevoly.petledger.core.idempotency.IdempotencyType;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * <h3>宠物账本配置属性 (Pet Ledger Configuration Properties)</h3>
 *
 * <p>
 * 对应 {@code application.yml} 中的配置项。前缀为 <b>pet-ledger</b>。
 * </p>
 *
 * <hr>
 *
 * <span style="color: gray; font-size: 0.9em;">
 * <b>Pet Ledger Configuration Properties.</b><br>
 * Maps to configuration items in {@code application.yml}. Prefix: <b>pet-ledger</b>.
 * </span>
 *
 * @author vevoly
 * @since 1.0.0
 */
@Data
@ConfigurationProperties(prefix = PetLedgerConstant.PET_LEDGER_ID)
public class PetLedgerProperties {

    /**
     * 快照根目录 (Base Directory).
     * <p>为空时不做快照，重启后从创世状态开始。</p>
     * <span style="color: gray;">Snapshot root. When unset no snapshots are taken and a restart begins from genesis.</span>
     */
    private String baseDir;

    /**
     * 节点名称 (Node Name).
     * <p>用于快照目录隔离与监控标签。</p>
     * <span style="color: gray;">Used for snapshot directory isolation and as the metrics tag. Default: "PetLedgerNode".</span>
     */
    private String nodeName = PetLedgerConstant.DEFAULT_NODE_NAME;

    /**
     * 宠物名最大字节数 (Maximum pet name length in UTF-8 bytes).
     * <span style="color: gray;">Default: 32.</span>
     */
    private int maxNameLength = PetLedgerConstant.DEFAULT_MAX_NAME_LENGTH;

    /**
     * 出块间隔 (Block Interval).
     * <p>0 表示只手动出块。支持格式: 6s, 500ms</p>
     * <span style="color: gray;">Zero means blocks are only produced on demand. Default: 6s.</span>
     */
    private Duration blockInterval = PetLedgerConstant.DEFAULT_BLOCK_INTERVAL;

    /**
     * 最终确认深度 (Finality Depth).
     * <p>区块在其后再出 N 个块时最终确认。</p>
     * <span style="color: gray;">A block is final once N further blocks are sealed on top of it. Default: 2.</span>
     */
    private int finalityDepth = PetLedgerConstant.DEFAULT_FINALITY_DEPTH;

    /**
     * 交易池大小 (Ring Buffer Size). 必须是 2 的幂 / must be a power of 2.
     * <p>满时新提交直接返回 DROPPED。</p>
     * <span style="color: gray;">When full, new submissions are DROPPED. Default: 1024.</span>
     */
    private int ringBufferSize = PetLedgerConstant.DEFAULT_RING_BUFFER_SIZE;

    /**
     * 自动快照间隔 (Snapshot Interval), 单位为区块 / in blocks.
     * <span style="color: gray;">0 disables count-triggered snapshots. Default: 100.</span>
     */
    private int snapshotInterval = PetLedgerConstant.DEFAULT_SNAPSHOT_INTERVAL;

    /**
     * 幂等去重策略类型 (Idempotency Strategy Type).
     * <p>默认 LRU，精确去重。</p>
     * <span style="color: gray;">Deduplication strategy. Default: LRU, which never rejects a fresh transaction.</span>
     */
    private IdempotencyType idempotency = IdempotencyType.LRU;

    /**
     * 去重容量 (Idempotency Capacity).
     * <p>LRU 记住的最近交易数；BLOOM 的预计插入数。</p>
     * <span style="color: gray;">Recent txs kept by LRU, or expected insertions of BLOOM. Default: 100,000.</span>
     */
    private int idempotencyCapacity = PetLedgerConstant.DEFAULT_IDEMPOTENCY_CAPACITY;

    /**
     * 布隆过滤器误判率 (Bloom False-Positive Rate).
     * <p>新交易被误判为重复并返回 INVALID 的概率，仅 BLOOM 使用。</p>
     * <span style="color: gray;">Chance that a fresh tx is rejected as a duplicate. BLOOM only. Default: 0.001.</span>
     */
    private double bloomFpp = PetLedgerConstant.DEFAULT_BLOOM_FPP;

    /**
     * 监控指标的前缀 (Metrics Prefix).
     * <span style="color: gray;">Default: "pet-ledger.".</span>
     */
    private String metricsPrefix = PetLedgerConstant.DEFAULT_METRICS_PREFIX;

    /**
     * 客户端配置 (Client settings).
     */
    private Client client = new Client();

    @Data
    public static class Client {

        /**
         * 单个状态的最长等待时间 (Maximum wait for the next status).
         * <p>超时判定为 INDETERMINATE。</p>
         * <span style="color: gray;">A timeout resolves to INDETERMINATE. Default: 60s.</span>
         */
        private Duration statusTimeout = PetLedgerConstant.DEFAULT_STATUS_TIMEOUT;
    }
}
