package alertcore.history;

import alertcore.model.AlertRecord;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * 告警历史接口 - 只追加、按时间升序、有保留窗口
 */
public interface AlertHistoryStore {
    /**
     * 追加记录，唯一的写操作
     */
    void append(AlertRecord record);

    /**
     * 最近一段时间内的记录，调用前先按保留窗口清理
     */
    List<AlertRecord> recent(Duration within);

    /**
     * 删除早于指定时间的记录
     */
    void prune(Instant olderThan);

    /**
     * 当前全部记录的不可变快照
     */
    List<AlertRecord> snapshot();
}
