package alertcore.config;

/**
 * 配置文件缺失必需项或格式错误，只在启动时抛出
 */
public class ConfigurationException extends RuntimeException {
    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
