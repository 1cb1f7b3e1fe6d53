package io.github.vevoly.petledger.starter;

import io.github.vevoly.petledger.api.IdempotencyStrategy;
import io.github.vevoly.petledger.api.LedgerTransport;
import io.github.vevoly.petledger.api.codec.CommandCodec;
import io.github.vevoly.petledger.api.crypto.Signer;
import io.github.vevoly.petledger.client.ConfirmationWatcher;
import io.github.vevoly.petledger.client.PetLedgerClient;
import io.github.vevoly.petledger.core.node.PetLedgerNode;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * <h3>核心自动装配类 (Core Auto-Configuration)</h3>
 *
 * <p>
 * 组装本地账本节点、确认监听器，以及（存在 {@link Signer} Bean 时）提交客户端。
 * 用户可以声明自己的 {@link LedgerTransport} Bean 连接远程节点，此时不会创建本地节点。
 * </p>
 *
 * <hr>
 *
 * <span style="color: gray; font-size: 0.9em;">
 * <b>Core Auto-Configuration.</b><br>
 * Assembles the local ledger node, the confirmation watcher and, when a {@link Signer} bean exists, the submission client.
 * Declaring your own {@link LedgerTransport} bean (e.g. for a remote node) replaces the local node.
 * </span>
 *
 * @author vevoly
 * @since 1.0.0
 */
@AutoConfiguration
@EnableConfigurationProperties(PetLedgerProperties.class)
public class PetLedgerAutoConfiguration {

    /**
     * 初始化幂等去重策略 (Initialize Idempotency Strategy).
     * <p>
     * 如果用户没有自定义 {@link IdempotencyStrategy} Bean，则根据配置文件创建默认策略。
     * </p>
     * <ul>
     *     <li><b>LRU (Default):</b> 精准去重，容量有限。</li>
     *     <li><b>BLOOM:</b> 适合海量数据，存在极低误判率。</li>
     * </ul>
     */
    @Bean
    @ConditionalOnMissingBean
    public IdempotencyStrategy idempotencyStrategy(PetLedgerProperties props) {
        return props.getIdempotency().create(props.getIdempotencyCapacity(), props.getBloomFpp());
    }

    /**
     * <h3>账本节点 Bean (Ledger Node Bean)</h3>
     *
     * <ul>
     *     <li><b>initMethod = "start":</b> 容器启动时恢复快照并启动出块。</li>
     *     <li><b>destroyMethod = "shutdown":</b> 容器销毁时结束未完成的状态流并保存快照。</li>
     * </ul>
     *
     * <hr>
     *
     * <span style="color: gray; font-size: 0.9em;">
     * <b>initMethod = "start"</b> restores the snapshot and starts block production.<br>
     * <b>destroyMethod = "shutdown"</b> ends open status streams and saves a snapshot.
     * </span>
     *
     * @param props 配置文件属性 (Properties)
     * @param idempotencyStrategy 去重策略 (Deduplication Strategy)
     * @param registryProvider Spring Boot 监控注册表 (Metrics Registry)
     * @return 未启动的节点 (Node, started by the container)
     */
    @Bean(initMethod = "start", destroyMethod = "shutdown")
    @ConditionalOnMissingBean(LedgerTransport.class)
    public PetLedgerNode petLedgerNode(
            PetLedgerProperties props,
            IdempotencyStrategy idempotencyStrategy,
            ObjectProvider<MeterRegistry> registryProvider
    ) {
        // 尝试获取 Bean，如果没有则返回 null / Try to get Bean, if nothing else return null
        MeterRegistry meterRegistry = registryProvider.getIfAvailable();
        return PetLedgerNode.builder()
                .name(props.getNodeName())
                .baseDir(props.getBaseDir())
                .maxNameLength(props.getMaxNameLength())
                .blockInterval(props.getBlockInterval())
                .finalityDepth(props.getFinalityDepth())
                .ringBufferSize(props.getRingBufferSize())
                .snapshotInterval(props.getSnapshotInterval())
                .idempotency(idempotencyStrategy)
                .meterRegistry(meterRegistry)
                .metricsPrefix(props.getMetricsPrefix())
                .build();
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public ConfirmationWatcher confirmationWatcher(LedgerTransport transport, PetLedgerProperties props) {
        return ConfirmationWatcher.builder()
                .transport(transport)
                .statusTimeout(props.getClient().getStatusTimeout())
                .build();
    }

    /**
     * 提交客户端 (Submission Client). 仅当存在 {@link Signer} Bean 时创建 / only when a signer bean exists.
     */
    @Bean
    @ConditionalOnBean(Signer.class)
    @ConditionalOnMissingBean
    public PetLedgerClient petLedgerClient(LedgerTransport transport, Signer signer, PetLedgerProperties props) {
        return new PetLedgerClient(transport, signer, new CommandCodec(props.getMaxNameLength()));
    }
}
