package jobhub.backend.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jobhub.backend.error.StorageException;

import java.io.IOException;
import java.util.Optional;

/**
 * Shared JSON codec for everything persisted in the object store.
 */
public final class Json {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private Json() {
    }

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    public static byte[] write(Object value) {
        try {
            return MAPPER.writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new StorageException("Cannot serialize " + value.getClass().getSimpleName(), e);
        }
    }

    public static <T> T read(byte[] content, Class<T> type) {
        try {
            return MAPPER.readValue(content, type);
        } catch (IOException e) {
            throw new StorageException("Cannot deserialize " + type.getSimpleName(), e);
        }
    }

    /** Read a stored object of the given type, empty when the key is absent */
    public static <T> Optional<T> read(ObjectStore store, String key, Class<T> type) {
        return store.get(key).map(bytes -> read(bytes, type));
    }
}
