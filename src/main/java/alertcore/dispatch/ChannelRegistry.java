package alertcore.dispatch;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * 通知通道注册表：按类型注册工厂，按配置创建通道实例
 */
@Slf4j
public class ChannelRegistry {

    @FunctionalInterface
    public interface ChannelFactory {
        NotificationChannel create(Map<String, Object> config, Clock clock);
    }

    private final Map<String, ChannelFactory> factories = new ConcurrentHashMap<>();
    private final Map<String, NotificationChannel> channels = new LinkedHashMap<>();

    public ChannelRegistry() {
        registerDefaultFactories();
    }

    private void registerDefaultFactories() {
        registerChannelFactory(NotificationChannel.ChannelType.EMAIL.key(), EmailChannel::new);
        registerChannelFactory(NotificationChannel.ChannelType.SLACK.key(), SlackChannel::new);
        registerChannelFactory(NotificationChannel.ChannelType.DINGDING.key(), DingdingChannel::new);
    }

    /**
     * 注册通道工厂
     */
    public void registerChannelFactory(String type, ChannelFactory factory) {
        factories.put(type.toLowerCase(Locale.ROOT), factory);
        log.debug("注册通道类型: {}", type);
    }

    /**
     * 按 notifications 配置段创建所有已知类型的通道，未知类型忽略
     */
    @SuppressWarnings("unchecked")
    public ChannelRegistry configure(Map<String, Object> notifications, Clock clock) {
        if (notifications == null) {
            return this;
        }
        for (Map.Entry<String, Object> entry : notifications.entrySet()) {
            String type = entry.getKey().toLowerCase(Locale.ROOT);
            ChannelFactory factory = factories.get(type);
            if (factory == null) {
                log.warn("未知的通知通道类型: {}", entry.getKey());
                continue;
            }
            Map<String, Object> config = entry.getValue() instanceof Map
                    ? (Map<String, Object>) entry.getValue()
                    : Collections.emptyMap();
            register(factory.create(config, clock));
        }
        return this;
    }

    public ChannelRegistry register(NotificationChannel channel) {
        channels.put(channel.getType().toLowerCase(Locale.ROOT), channel);
        log.info("通知通道 {} 已加载, enabled={}", channel.getType(), channel.isEnabled());
        return this;
    }

    public NotificationChannel get(String type) {
        return type == null ? null : channels.get(type.toLowerCase(Locale.ROOT));
    }

    public Collection<NotificationChannel> all() {
        return Collections.unmodifiableCollection(channels.values());
    }

    public List<NotificationChannel> enabled() {
        return channels.values().stream()
                .filter(NotificationChannel::isEnabled)
                .collect(Collectors.toList());
    }
}
