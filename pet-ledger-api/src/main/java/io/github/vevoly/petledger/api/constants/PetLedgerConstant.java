package io.github.vevoly.petledger.api.constants;

import java.time.Duration;

/**
 * 系统常量 / System constant
 *
 * @since 1.0.0
 * @author vevoly
 */
public class PetLedgerConstant {

    public static final String PET_LEDGER_ID = "pet-ledger";

    // 配置默认值 / Config default value
    public static final int DEFAULT_MAX_NAME_LENGTH = 32;
    public static final String DEFAULT_NODE_NAME = "PetLedgerNode";
    public static final Duration DEFAULT_BLOCK_INTERVAL = Duration.ofSeconds(6);
    public static final int DEFAULT_FINALITY_DEPTH = 2;
    public static final int DEFAULT_RING_BUFFER_SIZE = 1024;
    public static final int DEFAULT_SNAPSHOT_INTERVAL = 100;
    public static final int DEFAULT_LOCK_STRIPES = 64;
    public static final int DEFAULT_IDEMPOTENCY_CAPACITY = 100_000;
    public static final double DEFAULT_BLOOM_FPP = 0.001;
    public static final Duration DEFAULT_STATUS_TIMEOUT = Duration.ofSeconds(60);
    public static final String DEFAULT_METRICS_PREFIX = PET_LEDGER_ID + ".";

    // 链上约定 / Chain conventions
    public static final long GENESIS_HEIGHT = 0L;
    public static final long FIRST_BLOCK_HEIGHT = 1L;
    public static final long NEVER_FED = 0L;
    public static final String GENESIS_HASH = "0000000000000000000000000000000000000000000000000000000000000000";

    public static final String SNAPSHOT_DIR = "snapshot";

    private PetLedgerConstant() {
    }
}
