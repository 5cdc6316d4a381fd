package jobhub.backend.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;

/**
 * An application exposed by a job on a port (a notebook, a TensorBoard, an API).
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AppSpec(
        int port,
        Integer mapToPort,
        String appName,
        Map<String, String> urlQueryParams) {
}
