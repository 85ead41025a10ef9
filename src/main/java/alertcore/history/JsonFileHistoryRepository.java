package alertcore.history;

import alertcore.model.AlertRecord;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;

/**
 * 以 JSON 数组文件保存告警历史，最新的在末尾
 */
@Slf4j
public class JsonFileHistoryRepository implements HistoryRepository {
    public static final int MAX_PERSISTED_RECORDS = 1000;

    private final Path file;
    private final ObjectMapper objectMapper;

    public JsonFileHistoryRepository(Path file) {
        this.file = file;
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    public List<AlertRecord> load() {
        if (!Files.exists(file)) {
            log.debug("告警历史文件不存在，使用空历史: {}", file);
            return new ArrayList<>();
        }
        try {
            List<AlertRecord> records = objectMapper.readValue(file.toFile(), new TypeReference<List<AlertRecord>>() {});
            return records != null ? records : new ArrayList<>();
        } catch (IOException e) {
            throw new AlertStoreException("读取告警历史失败: " + file, e);
        }
    }

    @Override
    public void save(List<AlertRecord> records) {
        List<AlertRecord> tail = records.size() > MAX_PERSISTED_RECORDS
                ? records.subList(records.size() - MAX_PERSISTED_RECORDS, records.size())
                : records;
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
            objectMapper.writeValue(tmp.toFile(), tail);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new AlertStoreException("写入告警历史失败: " + file, e);
        }
    }

    public Path getFile() {
        return file;
    }
}
