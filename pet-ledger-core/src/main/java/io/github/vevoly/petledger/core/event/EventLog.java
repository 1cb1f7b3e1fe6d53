package io.github.vevoly.petledger.core.event;

import io.github.vevoly.petledger.api.event.EventRecord;
import io.github.vevoly.petledger.api.event.PetEvent;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * <h3>事件日志 (Event Log)</h3>
 *
 * <p>
 * 只追加、按调度顺序排列的领域事件序列。日志本身不做过滤或匹配，
 * 消费者（确认监听器）按区块或最近窗口读取事件后自行匹配。
 * </p>
 *
 * <hr>
 *
 * <span style="color: gray; font-size: 0.9em;">
 * <b>Event Log.</b><br>
 * Append-only sequence of domain events in dispatch order. The log performs no filtering or matching;
 * consumers (the confirmation watcher) read by block or by recent window and match on their side.
 * </span>
 *
 * @author vevoly
 * @since 1.0.0
 */
@Slf4j
public class EventLog {

    /**
     * 事件监听器 (Event listener), 在追加后同步回调 / invoked synchronously after each append.
     */
    @FunctionalInterface
    public interface Listener {
        void onEvent(EventRecord record);
    }

    private final List<EventRecord> records = new ArrayList<>();
    private final Map<Long, List<EventRecord>> byHeight = new TreeMap<>();
    private final List<Listener> listeners = new CopyOnWriteArrayList<>();

    /**
     * 追加事件 (Append an event).
     *
     * @param height  事件所在高度 (Height of the event)
     * @param txIndex 交易在区块内的序号，直接调用时为 -1 / index within the block, -1 when applied directly
     * @param txHash  交易哈希，直接调用时为 null / tx hash, null when applied directly
     * @param event   领域事件 (Domain event)
     * @return 带序号的事件记录 (The sequenced record)
     */
    public EventRecord append(long height, int txIndex, String txHash, PetEvent event) {
        EventRecord record;
        synchronized (this) {
            record = new EventRecord(records.size(), height, txIndex, txHash, event);
            records.add(record);
            byHeight.computeIfAbsent(height, h -> new ArrayList<>()).add(record);
        }
        for (Listener listener : listeners) {
            try {
                listener.onEvent(record);
            } catch (RuntimeException e) {
                log.warn("事件监听器执行失败 / Event listener failed, record #{}", record.getSequence(), e);
            }
        }
        return record;
    }

    /**
     * 指定高度的全部事件 (All events at the height), 按调度顺序 / in dispatch order.
     */
    public synchronized List<EventRecord> eventsAt(long height) {
        List<EventRecord> events = byHeight.get(height);
        return events == null ? Collections.emptyList() : List.copyOf(events);
    }

    /**
     * 最近的若干条事件 (The most recent events).
     *
     * @param window 窗口大小 (Window size)
     */
    public synchronized List<EventRecord> recent(int window) {
        if (window <= 0) {
            return Collections.emptyList();
        }
        int from = Math.max(0, records.size() - window);
        return List.copyOf(records.subList(from, records.size()));
    }

    public synchronized int size() {
        return records.size();
    }

    public void addListener(Listener listener) {
        listeners.add(listener);
    }

    public void removeListener(Listener listener) {
        listeners.remove(listener);
    }
}
