package io.github.vevoly.petledger.core.idempotency;

import io.github.vevoly.petledger.api.IdempotencyStrategy;
import io.github.vevoly.petledger.api.constants.PetLedgerConstant;

import java.io.Serial;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * <h3>基于 LRU 的精准去重策略 (LRU Exact Strategy)</h3>
 *
 * <p>
 * 利用 {@link LinkedHashMap} 记录最近导入的交易哈希，容量满时淘汰最久未访问的条目。
 * </p>
 * <ul>
 *     <li><b>优点：</b> 100% 准确，重复提交一定被识别，新交易不会被误拒。</li>
 *     <li><b>缺点：</b> 内存占用相对较高（存储完整哈希），只覆盖最近 maxCapacity 笔交易。</li>
 * </ul>
 *
 * <hr>
 *
 * <span style="color: gray; font-size: 0.9em;">
 * <b>LRU Exact Strategy.</b><br>
 * Remembers recently imported tx hashes in a {@link LinkedHashMap}, evicting the least recently used when full.<br>
 * <b>Pros:</b> exact, a fresh transaction is never rejected by mistake.<br>
 * <b>Cons:</b> stores full hashes; only the latest maxCapacity transactions are covered.
 * </span>
 *
 * @author vevoly
 * @since 1.0.0
 */
public class LruIdempotencyStrategy implements IdempotencyStrategy {
    @Serial
    private static final long serialVersionUID = 1L;

    /**
     * 静态内部类 Map，快照时由 JavaSerializer 处理以保留容量上限。
     * <br>
     * <span style="color: gray;">Static nested map; snapshots write it with JavaSerializer so the capacity survives.</span>
     */
    private LruHashMap<String, Boolean> cache;

    /**
     * 默认容量 100,000 (Defaults to 100,000 entries).
     */
    public LruIdempotencyStrategy() {
        this(PetLedgerConstant.DEFAULT_IDEMPOTENCY_CAPACITY);
    }

    /**
     * @param maxCapacity 最大容量 (Max Capacity). 超过此数量将淘汰最旧的数据 (Evict oldest when exceeded).
     */
    public LruIdempotencyStrategy(int maxCapacity) {
        if (maxCapacity <= 0) {
            throw new IllegalArgumentException("Max capacity must be greater than 0");
        }
        this.cache = new LruHashMap<>(maxCapacity);
    }

    @Override
    public boolean contains(String key) {
        return cache.containsKey(key);
    }

    @Override
    public void add(String key) {
        cache.put(key, Boolean.TRUE);
    }

    @Override
    public String getName() {
        return IdempotencyType.LRU.name();
    }

    int size() {
        return cache.size();
    }

    /**
     * <h3>自定义 LRU Map 实现 (Custom LRU Map Implementation)</h3>
     */
    public static class LruHashMap<K, V> extends LinkedHashMap<K, V> {
        @Serial
        private static final long serialVersionUID = 1L;

        private int maxCapacity;

        public LruHashMap(int maxCapacity) {
            // accessOrder = true: 按访问顺序排序 / order by access (LRU mode)
            super(16, 0.75f, true);
            this.maxCapacity = maxCapacity;
        }

        @Override
        protected boolean removeEldestEntry(Map.Entry<K, V> eldest) {
            return size() > maxCapacity;
        }
    }
}
