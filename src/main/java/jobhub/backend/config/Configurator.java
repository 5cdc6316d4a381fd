package jobhub.backend.config;

import java.util.Map;

/**
 * Turns raw settings into a validated {@link BackendConfig}.
 * Keys are {@code SECTION.field} paths, for example {@code CLOUD.folder_id}.
 */
public interface Configurator {

    /**
     * @throws jobhub.backend.error.BackendConfigException with the offending field paths
     */
    BackendConfig configure(Map<String, String> values);
}
