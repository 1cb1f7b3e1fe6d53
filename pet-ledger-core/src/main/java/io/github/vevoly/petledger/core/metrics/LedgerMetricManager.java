package io.github.vevoly.petledger.core.metrics;

import io.github.vevoly.petledger.api.constants.PetLedgerConstant;

/**
 * <h3>监控指标管理器 (Metric Manager)</h3>
 *
 * <p>根据可配置的前缀生成账本节点暴露给 Micrometer 的指标名称。</p>
 *
 * <hr>
 *
 * <span style="color: gray; font-size: 0.9em;">
 * <b>Metric Manager.</b><br>
 * Builds the names of the metrics the ledger node exposes to Micrometer from a configurable prefix.
 * </span>
 *
 * @author vevoly
 * @since 1.0.0
 */
public class LedgerMetricManager {

    // 指标名称 / Metric names
    public final String ringRemaining;
    public final String dispatchTime;
    public final String commandsApplied;
    public final String commandsFailed;
    public final String blocksSealed;

    // 标签名称 / Label names
    public static final String TAG_NODE = "node";
    public static final String TAG_COMMAND = "command";

    public LedgerMetricManager(String prefix) {
        if (prefix == null || prefix.trim().isEmpty()) {
            prefix = PetLedgerConstant.DEFAULT_METRICS_PREFIX;
        }
        if (!prefix.endsWith(".")) {
            prefix += ".";
        }
        this.ringRemaining = prefix + "ring.remaining";
        this.dispatchTime = prefix + "dispatch.time";
        this.commandsApplied = prefix + "commands.applied";
        this.commandsFailed = prefix + "commands.failed";
        this.blocksSealed = prefix + "blocks.sealed";
    }
}
