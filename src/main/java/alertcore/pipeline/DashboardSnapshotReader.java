package alertcore.pipeline;

import alertcore.model.MetricSnapshot;
import alertcore.model.ToolReading;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.Iterator;
import java.util.Map;

/**
 * 读取监控面板数据和最新的预测结果，转换为指标快照
 */
@Slf4j
public class DashboardSnapshotReader {
    private static final String PREDICTION_GLOB = "predictions_*.json";

    private final Path dashboardFile;
    private final Path logsDirectory;
    private final ObjectMapper objectMapper;

    public DashboardSnapshotReader(Path dashboardFile, Path logsDirectory) {
        this.dashboardFile = dashboardFile;
        this.logsDirectory = logsDirectory;
        this.objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    public MetricSnapshot read() {
        MetricSnapshot.MetricSnapshotBuilder builder = MetricSnapshot.builder();
        readDashboard(builder);
        readLatestPrediction(builder);
        return builder.build();
    }

    private void readDashboard(MetricSnapshot.MetricSnapshotBuilder builder) {
        if (!Files.exists(dashboardFile)) {
            log.warn("面板数据文件不存在: {}", dashboardFile);
            builder.dashboardAvailable(false);
            return;
        }
        JsonNode dashboard;
        try {
            dashboard = objectMapper.readTree(dashboardFile.toFile());
        } catch (IOException e) {
            log.warn("面板数据读取失败: {}", dashboardFile, e);
            builder.dashboardAvailable(false);
            builder.warning("面板数据读取失败: " + e.getMessage());
            return;
        }

        JsonNode system = dashboard.path("system");
        putIfPresent(builder, "disk_usage_percent", system.path("disk_usage").path("percent"));
        putIfPresent(builder, "memory_usage_percent", system.path("memory").path("percent"));
        putIfPresent(builder, "cpu_usage_percent", system.path("cpu").path("percent"));

        JsonNode details = dashboard.path("tools").path("details");
        Iterator<Map.Entry<String, JsonNode>> fields = details.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            builder.tool(toToolReading(entry.getKey(), entry.getValue()));
        }
    }

    private ToolReading toToolReading(String name, JsonNode info) {
        ToolReading.ToolReadingBuilder reading = ToolReading.builder()
                .name(name)
                .status(info.path("status").isMissingNode() ? null : info.path("status").asText())
                .rawDetails(pretty(info));
        putMetric(reading, "response_time_ms", info.get("response_time"));
        putMetric(reading, "error_rate_percent", info.get("error_rate"));
        putMetric(reading, "uptime_percent", info.get("uptime"));
        putMetric(reading, "memory_mb", info.get("memory_usage"));
        putMetric(reading, "cpu_percent", info.get("cpu_usage"));
        return reading.build();
    }

    private void readLatestPrediction(MetricSnapshot.MetricSnapshotBuilder builder) {
        Path latest = findLatestPrediction();
        if (latest == null) {
            return;
        }
        try {
            JsonNode predictions = objectMapper.readTree(latest.toFile());
            builder.criticalRisks(predictions.path("summary").path("critical_risks").asInt(0));
            builder.predictionDetails(pretty(predictions.path("predictions")));
        } catch (IOException e) {
            log.warn("预测结果读取失败: {}", latest, e);
            builder.warning("预测结果读取失败: " + latest.getFileName());
        }
    }

    Path findLatestPrediction() {
        if (logsDirectory == null || !Files.isDirectory(logsDirectory)) {
            return null;
        }
        Path latest = null;
        FileTime latestTime = null;
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(logsDirectory, PREDICTION_GLOB)) {
            for (Path path : stream) {
                FileTime modified = Files.getLastModifiedTime(path);
                if (latestTime == null || modified.compareTo(latestTime) > 0) {
                    latest = path;
                    latestTime = modified;
                }
            }
        } catch (IOException e) {
            log.warn("扫描预测结果目录失败: {}", logsDirectory, e);
        }
        return latest;
    }

    private static void putIfPresent(MetricSnapshot.MetricSnapshotBuilder builder, String metric, JsonNode node) {
        Object value = toValue(node);
        if (value != null) {
            builder.systemMetric(metric, value);
        }
    }

    private static void putMetric(ToolReading.ToolReadingBuilder reading, String metric, JsonNode node) {
        Object value = toValue(node);
        if (value != null) {
            reading.metric(metric, value);
        }
    }

    /**
     * 数值保持为数值，其余原样交给评估器判断
     */
    private static Object toValue(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return null;
        }
        return node.isNumber() ? node.numberValue() : node.asText();
    }

    private String pretty(JsonNode node) {
        try {
            return objectMapper.writeValueAsString(node);
        } catch (IOException e) {
            return node.toString();
        }
    }
}
