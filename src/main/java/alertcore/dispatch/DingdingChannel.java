package alertcore.dispatch;

import alertcore.model.Alert;
import com.dingtalk.api.DefaultDingTalkClient;
import com.dingtalk.api.DingTalkClient;
import com.dingtalk.api.request.OapiRobotSendRequest;
import com.dingtalk.api.response.OapiRobotSendResponse;
import com.taobao.api.ApiException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.collections4.CollectionUtils;
import org.apache.commons.lang3.StringUtils;

import java.time.Clock;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;

/**
 * 钉钉机器人通道
 */
@Slf4j
public class DingdingChannel extends NotificationChannel {
    private static final DateTimeFormatter TIME_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm").withZone(ZoneId.of("Asia/Shanghai"));

    private final String webhookUrl;
    private final Clock clock;

    @SuppressWarnings("unchecked")
    public DingdingChannel(Map<String, Object> config, Clock clock) {
        super(ChannelType.DINGDING, Boolean.TRUE.equals(config.get("enabled")), (List<String>) config.get("users"));
        this.webhookUrl = (String) config.get("webhook_url");
        this.clock = clock;
    }

    @Override
    public void deliver(Alert alert) {
        if (StringUtils.isBlank(webhookUrl)) {
            throw new TransportException("钉钉 webhook_url 未配置");
        }
        DingTalkClient client = new DefaultDingTalkClient(webhookUrl);
        OapiRobotSendRequest request = new OapiRobotSendRequest();
        request.setMsgtype("markdown");
        OapiRobotSendRequest.Markdown markdown = new OapiRobotSendRequest.Markdown();
        markdown.setTitle("【告警】" + alert.getTitle());
        markdown.setText(buildMarkdown(alert));
        request.setMarkdown(markdown);
        try {
            OapiRobotSendResponse response = client.execute(request);
            if (!response.isSuccess()) {
                throw new TransportException("钉钉返回错误: " + response.getErrmsg());
            }
            log.info("钉钉告警发送成功: {}", alert.getTitle());
        } catch (ApiException e) {
            throw new TransportException("发送钉钉告警失败: " + e.getMessage(), e);
        }
    }

    String buildMarkdown(Alert alert) {
        StringBuilder recipientsStr = new StringBuilder();
        if (CollectionUtils.isNotEmpty(recipients)) {
            for (String recipient : recipients) {
                recipientsStr.append("@").append(recipient).append(" ");
            }
        }
        String time = TIME_FORMAT.format(alert.getTimestamp() != null ? alert.getTimestamp() : clock.instant());
        return "# 🚨 " + alert.getTitle() + "\n\n" +
                "**级别**: " + alert.getLevel() + "  \n\n" +
                "**时间**: " + time + "  \n\n" +
                "**来源**: " + StringUtils.defaultIfBlank(alert.getSource(), "unknown") + "  \n\n" +
                "**描述**: " + StringUtils.defaultString(alert.getMessage()) + "\n\n" +
                "**负责人**: " + recipientsStr + "\n\n" +
                "---\n";
    }

    @Override
    public String describe() {
        return "webhook=" + (StringUtils.isNotBlank(webhookUrl) ? "Configured" : "Not configured");
    }
}
