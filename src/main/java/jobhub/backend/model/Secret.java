package jobhub.backend.model;

import java.util.Objects;

public record Secret(String name, String value) {

    public Secret {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(value, "value is required");
    }

    @Override
    public String toString() {
        return "Secret{name='" + name + "'}";
    }
}
