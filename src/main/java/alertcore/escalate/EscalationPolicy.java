package alertcore.escalate;

import alertcore.model.Alert;
import alertcore.model.AlertRecord;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * 升级策略 - 根据历史记录判断告警是否需要提升级别
 */
public interface EscalationPolicy {

    String name();

    boolean isEnabled();

    /**
     * 只返回比当前级别更高的升级结论
     *
     * @param history 按时间升序的历史记录
     */
    Optional<Escalation> evaluate(Alert alert, List<AlertRecord> history, Instant now);
}
