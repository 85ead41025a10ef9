package alertcore.dispatch;

import alertcore.model.Alert;
import lombok.Getter;

import java.util.List;
import java.util.Locale;

/**
 * 通知通道基类
 */
@Getter
public abstract class NotificationChannel {

    public enum ChannelType {
        EMAIL,
        SLACK,
        DINGDING;

        public String key() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    protected final String type;
    protected final boolean enabled;
    protected final List<String> recipients;

    protected NotificationChannel(ChannelType type, boolean enabled, List<String> recipients) {
        this(type.key(), enabled, recipients);
    }

    protected NotificationChannel(String type, boolean enabled, List<String> recipients) {
        this.type = type;
        this.enabled = enabled;
        this.recipients = recipients != null ? List.copyOf(recipients) : List.of();
    }

    /**
     * 投递告警，失败时抛出 TransportException
     */
    public abstract void deliver(Alert alert) throws TransportException;

    /**
     * status 命令展示的配置摘要，不含密钥
     */
    public abstract String describe();
}
