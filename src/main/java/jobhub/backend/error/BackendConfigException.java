package jobhub.backend.error;

import java.util.List;

/**
 * Misconfiguration. Carries a machine-readable code and the offending field paths
 * (for example {@code CLOUD.folder_id}) so a UI can highlight them.
 */
public class BackendConfigException extends BackendException {

    public static final String INVALID_CONFIG = "invalid_config";
    public static final String MISSING_FIELD = "missing_field";
    public static final String INVALID_VALUE = "invalid_value";

    private final String code;
    private final List<String> fields;

    public BackendConfigException(String message, String code, List<String> fields) {
        super(message);
        this.code = code != null ? code : INVALID_CONFIG;
        this.fields = fields != null ? List.copyOf(fields) : List.of();
    }

    public BackendConfigException(String message, String code, List<String> fields, Throwable cause) {
        super(message, cause);
        this.code = code != null ? code : INVALID_CONFIG;
        this.fields = fields != null ? List.copyOf(fields) : List.of();
    }

    public static BackendConfigException missing(String field) {
        return new BackendConfigException("Missing required setting: " + field, MISSING_FIELD, List.of(field));
    }

    public static BackendConfigException invalid(String field, String reason) {
        return new BackendConfigException("Invalid value of " + field + ": " + reason, INVALID_VALUE, List.of(field));
    }

    public String code() {
        return code;
    }

    public List<String> fields() {
        return fields;
    }
}
