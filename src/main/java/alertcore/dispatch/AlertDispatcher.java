package alertcore.dispatch;

import alertcore.history.AlertHistoryStore;
import alertcore.model.Alert;
import alertcore.model.AlertRecord;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.digest.DigestUtils;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 告警分发器：按级别路由到通知通道，投递后无论成败都写一条历史记录
 */
@Slf4j
public class AlertDispatcher implements AutoCloseable {
    private final ChannelRegistry registry;
    private final RoutingSettings routing;
    private final Clock clock;
    private final Duration channelTimeout;
    private final ExecutorService channelExecutor;

    public AlertDispatcher(ChannelRegistry registry, RoutingSettings routing, Clock clock, Duration channelTimeout) {
        this.registry = registry;
        this.routing = routing;
        this.clock = clock;
        this.channelTimeout = channelTimeout;
        this.channelExecutor = new ThreadPoolExecutor(
                2, 4, 60L, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(100),
                new ThreadFactoryBuilder().setNameFormat("alert-channel-%d").setDaemon(true).build(),
                new ThreadPoolExecutor.CallerRunsPolicy()
        );
    }

    /**
     * 普通发送路径，通道由级别决定
     */
    public boolean send(Alert alert, AlertHistoryStore history) {
        List<String> channels = routing.channelsFor(alert.getLevel());
        return deliverAndRecord(alert, channels, history);
    }

    /**
     * 升级发送路径：改写标题和正文，级别通道并上升级通道
     */
    public boolean sendEscalated(Alert alert, AlertHistoryStore history) {
        alert.decorateAsEscalated();
        List<String> channels = routing.escalatedChannelsFor(alert.getLevel());
        log.info("发送升级告警: {} -> {}", alert.getTitle(), channels);
        return deliverAndRecord(alert, channels, history);
    }

    /**
     * 直接投递到指定通道，不经过路由也不写历史
     */
    public Map<String, Boolean> deliverDirect(Alert alert, Collection<String> channelNames) {
        return deliverAll(alert, channelNames);
    }

    private boolean deliverAndRecord(Alert alert, List<String> channels, AlertHistoryStore history) {
        Map<String, Boolean> results = deliverAll(alert, channels);
        boolean success = results.containsValue(Boolean.TRUE);
        if (!success) {
            log.warn("告警所有通道均发送失败: {}", alert.getTitle());
        }
        history.append(toRecord(alert, channels, success));
        return success;
    }

    private Map<String, Boolean> deliverAll(Alert alert, Collection<String> channelNames) {
        Map<String, Future<?>> futures = new LinkedHashMap<>();
        for (String name : channelNames) {
            NotificationChannel channel = registry.get(name);
            if (channel == null || !channel.isEnabled()) {
                log.debug("通道 {} 未启用，跳过", name);
                continue;
            }
            futures.put(name, channelExecutor.submit(() -> channel.deliver(alert)));
        }

        Map<String, Boolean> results = new LinkedHashMap<>();
        long deadline = System.nanoTime() + channelTimeout.toNanos();
        for (Map.Entry<String, Future<?>> entry : futures.entrySet()) {
            results.put(entry.getKey(), await(entry.getKey(), entry.getValue(), deadline, alert));
        }
        return results;
    }

    private boolean await(String name, Future<?> future, long deadline, Alert alert) {
        try {
            future.get(Math.max(0L, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
            return true;
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("通道 {} 发送超时 ({}s): {}", name, channelTimeout.toSeconds(), alert.getTitle());
            return false;
        } catch (ExecutionException e) {
            log.warn("通道 {} 发送失败: {}", name, e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            log.warn("等待通道 {} 时被中断", name);
            return false;
        }
    }

    AlertRecord toRecord(Alert alert, List<String> channels, boolean success) {
        Instant now = clock.instant();
        return AlertRecord.builder()
                .id(generateRecordId(now, alert))
                .timestamp(now)
                .level(alert.getLevel())
                .title(alert.getHistoryTitle())
                .source(alert.getSource())
                .channels(new ArrayList<>(channels))
                .success(success)
                .escalated(alert.isEscalated())
                .escalationReason(alert.getEscalationReason())
                .build();
    }

    private static String generateRecordId(Instant timestamp, Alert alert) {
        return DigestUtils.md5Hex(timestamp + alert.getHistoryTitle() + alert.getSource());
    }

    @Override
    public void close() {
        channelExecutor.shutdown();
        try {
            if (!channelExecutor.awaitTermination(10, TimeUnit.SECONDS)) {
                channelExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            channelExecutor.shutdownNow();
        }
    }
}
