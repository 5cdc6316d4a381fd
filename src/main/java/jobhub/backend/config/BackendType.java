package jobhub.backend.config;

import jobhub.backend.error.BackendConfigException;

import java.util.Locale;

/**
 * Provider implementations a backend can be built from.
 */
public enum BackendType {
    /** Local processes, H2 or file system storage */
    LOCAL,
    /** Yandex Cloud Compute preemptible VMs */
    YANDEX;

    public static BackendType parse(String value) {
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw BackendConfigException.invalid("BACKEND.type", "unknown backend type '" + value + "'");
        }
    }
}
