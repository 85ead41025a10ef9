package alertcore.history;

/**
 * 告警历史读写异常
 */
public class AlertStoreException extends RuntimeException {
    public AlertStoreException(String message) {
        super(message);
    }

    public AlertStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
