package alertcore.correlate;

import alertcore.model.Alert;
import alertcore.model.AlertLevel;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Locale;
import java.util.Set;

/**
 * 关联模式 - 标题或正文命中任一关键字且来源在允许集合内即匹配
 */
@Value
@Builder
public class CorrelationPattern {
    String name;
    @Singular
    Set<String> keywords;
    @Singular
    Set<String> sources;
    String groupTitle;
    /** 可为空；只在不低于成员最高级别时生效 */
    AlertLevel groupLevel;

    public boolean matches(Alert alert) {
        if (alert.getSource() == null || !sources.contains(alert.getSource())) {
            return false;
        }
        String text = (nullToEmpty(alert.getTitle()) + " " + nullToEmpty(alert.getMessage())).toLowerCase(Locale.ROOT);
        for (String keyword : keywords) {
            if (text.contains(keyword.toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
