package alertcore.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * 告警历史记录 - 每次发送尝试后追加一条，无论成功与否
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class AlertRecord {
    private String id;
    private Instant timestamp;
    private AlertLevel level;
    private String title;
    private String source;
    private List<String> channels;
    private boolean success;
    private boolean escalated;
    private String escalationReason;

    /**
     * 是否与告警属于同一类型 (title + source)
     */
    public boolean matches(Alert alert) {
        return alert != null
                && alert.getHistoryTitle() != null
                && alert.getHistoryTitle().equals(title)
                && alert.getSource() != null
                && alert.getSource().equals(source);
    }
}
