package alertcore.dispatch;

import alertcore.model.Alert;
import alertcore.model.AlertLevel;
import alertcore.utils.HttpUtils;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Slack webhook 通道
 */
@Slf4j
public class SlackChannel extends NotificationChannel {
    private static final Map<AlertLevel, String> LEVEL_COLORS = new EnumMap<>(AlertLevel.class);

    static {
        LEVEL_COLORS.put(AlertLevel.CRITICAL, "#ff0000");
        LEVEL_COLORS.put(AlertLevel.HIGH, "#ff8000");
        LEVEL_COLORS.put(AlertLevel.MEDIUM, "#ffff00");
        LEVEL_COLORS.put(AlertLevel.LOW, "#00ff00");
    }

    private final String webhookUrl;
    private final String channel;
    private final String username;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public SlackChannel(Map<String, Object> config, Clock clock) {
        super(ChannelType.SLACK, Boolean.TRUE.equals(config.get("enabled")), null);
        this.webhookUrl = (String) config.get("webhook_url");
        this.channel = (String) config.getOrDefault("channel", "#alerts");
        this.username = (String) config.getOrDefault("username", "Tool Monitor");
        this.objectMapper = new ObjectMapper();
        this.clock = clock;
    }

    @Override
    public void deliver(Alert alert) {
        if (StringUtils.isBlank(webhookUrl)) {
            throw new TransportException("Slack webhook_url 未配置");
        }
        try {
            HttpUtils.postJson(webhookUrl, null, buildPayload(alert));
            log.info("Slack告警发送成功: {}", alert.getTitle());
        } catch (IOException e) {
            throw new TransportException("发送Slack告警失败: " + e.getMessage(), e);
        }
    }

    String buildPayload(Alert alert) throws JsonProcessingException {
        List<Map<String, Object>> fields = new ArrayList<>();
        fields.add(field("Level", alert.getLevel() != null ? alert.getLevel().name() : "UNKNOWN", true));
        fields.add(field("Source", StringUtils.defaultIfBlank(alert.getSource(), "unknown"), true));
        fields.add(field("Time", String.valueOf(alert.getTimestamp() != null ? alert.getTimestamp() : clock.instant()), false));
        if (StringUtils.isNotBlank(alert.getDetails())) {
            fields.add(field("Details", "```" + alert.getDetails() + "```", false));
        }

        Map<String, Object> attachment = new LinkedHashMap<>();
        attachment.put("color", LEVEL_COLORS.getOrDefault(alert.getLevel(), "#808080"));
        attachment.put("title", "🚨 " + alert.getTitle());
        attachment.put("fields", fields);
        attachment.put("text", StringUtils.defaultIfBlank(alert.getMessage(), "No message provided"));
        attachment.put("footer", "Tool Monitor");
        attachment.put("ts", clock.instant().getEpochSecond());

        Map<String, Object> message = new LinkedHashMap<>();
        message.put("channel", channel);
        message.put("username", username);
        message.put("attachments", List.of(attachment));
        return objectMapper.writeValueAsString(message);
    }

    private static Map<String, Object> field(String title, String value, boolean isShort) {
        Map<String, Object> field = new LinkedHashMap<>();
        field.put("title", title);
        field.put("value", value);
        field.put("short", isShort);
        return field;
    }

    @Override
    public String describe() {
        return "channel=" + channel + ", webhook=" + (StringUtils.isNotBlank(webhookUrl) ? "Configured" : "Not configured");
    }
}
