package alertcore.history;

import alertcore.model.AlertRecord;

import java.util.List;

/**
 * 告警历史持久化
 */
public interface HistoryRepository {

    List<AlertRecord> load() throws AlertStoreException;

    void save(List<AlertRecord> records) throws AlertStoreException;
}
