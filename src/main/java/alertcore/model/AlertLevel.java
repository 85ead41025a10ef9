package alertcore.model;

import java.util.Locale;

/**
 * 告警级别 - 声明顺序即严重程度顺序 LOW < MEDIUM < HIGH < CRITICAL
 */
public enum AlertLevel {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    public int rank() {
        return ordinal() + 1;
    }

    public boolean isHigherThan(AlertLevel other) {
        return other == null || compareTo(other) > 0;
    }

    public static AlertLevel max(AlertLevel a, AlertLevel b) {
        if (a == null) {
            return b;
        }
        if (b == null) {
            return a;
        }
        return a.compareTo(b) >= 0 ? a : b;
    }

    /**
     * 解析级别名称，大小写不敏感
     *
     * @throws IllegalArgumentException 未知级别
     */
    public static AlertLevel fromString(String level) {
        if (level == null) {
            throw new IllegalArgumentException("告警级别不能为空");
        }
        try {
            return valueOf(level.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("未知的告警级别: " + level, e);
        }
    }
}
