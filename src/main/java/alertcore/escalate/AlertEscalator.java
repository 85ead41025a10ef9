package alertcore.escalate;

import alertcore.model.Alert;
import alertcore.model.AlertRecord;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * 告警升级器 - 按固定顺序检查策略，第一个生效的策略决定结果，不叠加
 */
@Slf4j
public class AlertEscalator {
    private final EscalationSettings settings;
    private final Clock clock;

    public AlertEscalator(EscalationSettings settings, Clock clock) {
        this.settings = settings;
        this.clock = clock;
    }

    /**
     * @return 级别被提升时返回 true，告警被原地修改
     */
    public boolean maybeEscalate(Alert alert, List<AlertRecord> history) {
        if (!settings.isEnabled() || alert.getLevel() == null) {
            return false;
        }
        Instant now = clock.instant();
        for (EscalationPolicy policy : settings.orderedPolicies()) {
            if (policy == null || !policy.isEnabled()) {
                continue;
            }
            Optional<Escalation> escalation = policy.evaluate(alert, history, now);
            if (escalation.isPresent() && escalation.get().getTarget().isHigherThan(alert.getLevel())) {
                log.info("告警升级: {} {} -> {} ({})", alert.getTitle(), alert.getLevel(),
                        escalation.get().getTarget(), escalation.get().getReason());
                alert.escalateTo(escalation.get().getTarget(), escalation.get().getReason());
                return true;
            }
        }
        return false;
    }
}
