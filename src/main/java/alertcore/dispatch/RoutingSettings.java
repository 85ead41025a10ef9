package alertcore.dispatch;

import alertcore.model.AlertLevel;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 级别到通道的路由表，以及升级告警强制附加的通道
 */
@Value
@Builder
public class RoutingSettings {
    @Singular("levelRoute")
    Map<AlertLevel, List<String>> levelChannels;
    @Singular
    List<String> escalationChannels;

    public List<String> channelsFor(AlertLevel level) {
        List<String> channels = levelChannels.get(level);
        return channels != null ? channels : List.of();
    }

    /**
     * 级别通道与升级通道的并集，保持声明顺序
     */
    public List<String> escalatedChannelsFor(AlertLevel level) {
        Set<String> union = new LinkedHashSet<>(channelsFor(level));
        union.addAll(escalationChannels);
        return new ArrayList<>(union);
    }
}
