package alertcore.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 告警配置文档：内置默认值与用户配置按键深度合并，支持点号路径读取
 */
@Slf4j
public class AlertingConfig {
    public static final String DEFAULTS_RESOURCE = "alerting-defaults.yml";

    private static final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
    private static final ObjectMapper jsonMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private final Map<String, Object> config;
    private final Path userConfigPath;

    AlertingConfig(Map<String, Object> config, Path userConfigPath) {
        this.config = config;
        this.userConfigPath = userConfigPath;
    }

    /**
     * 加载配置，用户文件不存在时只使用默认值
     */
    public static AlertingConfig load(Path userConfigPath) {
        Map<String, Object> merged = loadDefaults();
        if (userConfigPath != null && Files.exists(userConfigPath)) {
            merged = deepMerge(merged, readDocument(userConfigPath));
            log.info("已加载告警配置: {}", userConfigPath);
        } else {
            log.info("告警配置文件不存在，使用默认配置: {}", userConfigPath);
        }
        return new AlertingConfig(merged, userConfigPath);
    }

    /**
     * 只含内置默认值的配置
     */
    public static AlertingConfig defaults() {
        return new AlertingConfig(loadDefaults(), null);
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> loadDefaults() {
        try (InputStream in = AlertingConfig.class.getClassLoader().getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in == null) {
                throw new ConfigurationException("默认配置资源不存在: " + DEFAULTS_RESOURCE);
            }
            return yamlMapper.readValue(in, LinkedHashMap.class);
        } catch (IOException e) {
            throw new ConfigurationException("加载默认配置失败: " + DEFAULTS_RESOURCE, e);
        }
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> readDocument(Path path) {
        try {
            String content = Files.readString(path, StandardCharsets.UTF_8);
            if (StringUtils.isBlank(content)) {
                log.info("配置文件为空，使用默认配置: {}", path);
                return new LinkedHashMap<>();
            }
            // YAML 兼容 JSON，两种格式都用 YAML 解析
            Map<String, Object> doc = yamlMapper.readValue(content, LinkedHashMap.class);
            return doc != null ? doc : new LinkedHashMap<>();
        } catch (IOException e) {
            throw new ConfigurationException("加载配置文件失败: " + path, e);
        }
    }

    /**
     * 深度合并：两边都是 Map 时递归，否则 overlay 覆盖
     */
    @SuppressWarnings("unchecked")
    static Map<String, Object> deepMerge(Map<String, Object> base, Map<String, Object> overlay) {
        Map<String, Object> result = new LinkedHashMap<>(base);
        for (Map.Entry<String, Object> entry : overlay.entrySet()) {
            Object existing = result.get(entry.getKey());
            Object value = entry.getValue();
            if (existing instanceof Map && value instanceof Map) {
                result.put(entry.getKey(), deepMerge((Map<String, Object>) existing, (Map<String, Object>) value));
            } else {
                result.put(entry.getKey(), value);
            }
        }
        return result;
    }

    /**
     * 修改用户配置文件中的一个值并写回，文件不存在时新建
     */
    @SuppressWarnings("unchecked")
    public void persistValue(String key, Object value) {
        if (userConfigPath == null) {
            throw new ConfigurationException("未指定用户配置文件，无法保存: " + key);
        }
        Map<String, Object> doc = Files.exists(userConfigPath) ? readDocument(userConfigPath) : new LinkedHashMap<>();
        putValue(doc, key, value);
        putValue(config, key, value);
        try {
            Path parent = userConfigPath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            ObjectMapper writer = userConfigPath.toString().endsWith(".json") ? jsonMapper : yamlMapper;
            writer.writeValue(userConfigPath.toFile(), doc);
            log.info("配置已保存: {} = {}", key, value);
        } catch (IOException e) {
            throw new ConfigurationException("保存配置文件失败: " + userConfigPath, e);
        }
    }

    @SuppressWarnings("unchecked")
    private static void putValue(Map<String, Object> doc, String key, Object value) {
        String[] parts = key.split("\\.");
        Map<String, Object> current = doc;
        for (int i = 0; i < parts.length - 1; i++) {
            Object child = current.get(parts[i]);
            if (!(child instanceof Map)) {
                child = new LinkedHashMap<String, Object>();
                current.put(parts[i], child);
            }
            current = (Map<String, Object>) child;
        }
        current.put(parts[parts.length - 1], value);
    }

    public Path getUserConfigPath() {
        return userConfigPath;
    }

    /**
     * 获取字符串配置
     */
    public String getString(String key) {
        return getString(key, null);
    }

    public String getString(String key, String defaultValue) {
        Object value = getValue(key);
        return value != null ? value.toString() : defaultValue;
    }

    /**
     * 获取整数配置，格式错误时抛出 ConfigurationException
     */
    public int getInt(String key, int defaultValue) {
        Object value = getValue(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("配置项 " + key + " 不是整数: " + value, e);
        }
    }

    /**
     * 获取布尔配置
     */
    public boolean getBoolean(String key, boolean defaultValue) {
        Object value = getValue(key);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof String) {
            return Boolean.parseBoolean((String) value);
        }
        return defaultValue;
    }

    /**
     * 获取列表配置
     */
    @SuppressWarnings("unchecked")
    public List<String> getStringList(String key) {
        Object value = getValue(key);
        if (value instanceof List) {
            return (List<String>) value;
        }
        return Collections.emptyList();
    }

    /**
     * 获取子配置
     */
    @SuppressWarnings("unchecked")
    public Map<String, Object> getSubConfig(String key) {
        Object value = getValue(key);
        if (value instanceof Map) {
            return (Map<String, Object>) value;
        }
        return Collections.emptyMap();
    }

    @SuppressWarnings("unchecked")
    private Object getValue(String key) {
        if (StringUtils.isEmpty(key)) {
            return null;
        }
        String[] parts = key.split("\\.");
        Map<String, Object> current = config;
        for (int i = 0; i < parts.length - 1; i++) {
            Object value = current.get(parts[i]);
            if (!(value instanceof Map)) {
                return null;
            }
            current = (Map<String, Object>) value;
        }
        return current.get(parts[parts.length - 1]);
    }
}
