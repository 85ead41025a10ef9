package alertcore.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * 待发送告警 - 由阈值评估器或关联器创建，升级器可原地修改级别、标题和正文
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Alert {
    public static final String ESCALATED_TITLE_PREFIX = "ESCALATED: ";

    private AlertLevel level;
    private String title;
    private String message;
    private String source;
    private Instant timestamp;

    // 阈值类告警才有
    private String tool;
    private String metric;
    private Double value;
    private Double threshold;

    private String details;
    private String escalationReason;
    private CorrelationGroup correlationGroup;

    /** 升级改写标题前的原始标题，历史记录按它匹配 */
    private String baseTitle;

    public boolean isCorrelated() {
        return correlationGroup != null;
    }

    public boolean isEscalated() {
        return escalationReason != null;
    }

    /**
     * 写入历史时使用的标题 - 不带升级前缀
     */
    public String getHistoryTitle() {
        return baseTitle != null ? baseTitle : title;
    }

    /**
     * 提升级别并记录原因
     */
    public void escalateTo(AlertLevel target, String reason) {
        this.level = target;
        this.escalationReason = reason;
    }

    /**
     * 为升级发送路径改写标题和正文，重复调用不会叠加前缀
     */
    public void decorateAsEscalated() {
        if (baseTitle != null) {
            return;
        }
        String reason = escalationReason != null ? escalationReason : "Unknown escalation";
        this.baseTitle = title;
        this.title = ESCALATED_TITLE_PREFIX + title;
        this.message = "🚨 ESCALATED ALERT 🚨\n" + reason + "\n\n" + (message != null ? message : "");
    }
}
