package alertcore.escalate;

import alertcore.model.AlertLevel;
import lombok.Value;

/**
 * 策略给出的升级结论
 */
@Value
public class Escalation {
    AlertLevel target;
    String reason;
}
