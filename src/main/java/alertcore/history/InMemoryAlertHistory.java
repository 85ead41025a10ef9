package alertcore.history;

import alertcore.model.AlertRecord;
import com.google.common.collect.ImmutableList;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 内存中的告警历史 - 一次批处理内使用，开始时从文件加载，结束时整体写回
 */
@Slf4j
public class InMemoryAlertHistory implements AlertHistoryStore {
    private final Clock clock;
    private final Duration retention;
    private final List<AlertRecord> records;

    public InMemoryAlertHistory(Clock clock, Duration retention) {
        this(clock, retention, List.of());
    }

    public InMemoryAlertHistory(Clock clock, Duration retention, Collection<AlertRecord> initial) {
        this.clock = clock;
        this.retention = retention;
        this.records = initial.stream()
                .filter(r -> r.getTimestamp() != null)
                .sorted(Comparator.comparing(AlertRecord::getTimestamp))
                .collect(Collectors.toCollection(ArrayList::new));
    }

    @Override
    public synchronized void append(AlertRecord record) {
        if (record.getTimestamp() == null) {
            record.setTimestamp(clock.instant());
        }
        // 时间戳只增不减，乱序时插入到正确位置
        int index = records.size();
        while (index > 0 && records.get(index - 1).getTimestamp().isAfter(record.getTimestamp())) {
            index--;
        }
        records.add(index, record);
    }

    @Override
    public synchronized List<AlertRecord> recent(Duration within) {
        Instant now = clock.instant();
        prune(now.minus(retention));
        Instant cutoff = now.minus(within);
        List<AlertRecord> result = new ArrayList<>();
        for (int i = records.size() - 1; i >= 0; i--) {
            AlertRecord record = records.get(i);
            if (!record.getTimestamp().isAfter(cutoff)) {
                break;
            }
            result.add(record);
        }
        return ImmutableList.copyOf(result).reverse();
    }

    @Override
    public synchronized void prune(Instant olderThan) {
        int before = records.size();
        records.removeIf(r -> !r.getTimestamp().isAfter(olderThan));
        int removed = before - records.size();
        if (removed > 0) {
            log.debug("清理过期告警历史 {} 条，剩余 {} 条", removed, records.size());
        }
    }

    @Override
    public synchronized List<AlertRecord> snapshot() {
        return ImmutableList.copyOf(records);
    }

    public Duration getRetention() {
        return retention;
    }
}
