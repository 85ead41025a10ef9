package alertcore.dispatch;

import alertcore.model.Alert;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 记录投递内容的测试通道，可配置为失败或延迟
 */
public class FakeChannel extends NotificationChannel {
    private final List<Alert> delivered = new CopyOnWriteArrayList<>();
    private volatile boolean failing;
    private volatile Duration delay = Duration.ZERO;

    public FakeChannel(String type, boolean enabled) {
        super(type, enabled, List.of());
    }

    public FakeChannel failing() {
        this.failing = true;
        return this;
    }

    public FakeChannel delayedBy(Duration delay) {
        this.delay = delay;
        return this;
    }

    @Override
    public void deliver(Alert alert) {
        if (!delay.isZero()) {
            try {
                Thread.sleep(delay.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new TransportException("interrupted", e);
            }
        }
        if (failing) {
            throw new TransportException(getType() + " unavailable");
        }
        delivered.add(alert.toBuilder().build());
    }

    @Override
    public String describe() {
        return "fake";
    }

    public List<Alert> getDelivered() {
        return delivered;
    }
}
