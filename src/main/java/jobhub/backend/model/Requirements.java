package jobhub.backend.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Resources a job asks for. Null fields mean "no constraint".
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Requirements(
        Integer cpus,
        Integer memoryMib,
        Integer gpus,
        boolean interruptible) {

    public static Requirements none() {
        return new Requirements(null, null, null, false);
    }

    /** Check whether an instance type satisfies these requirements */
    public boolean isSatisfiedBy(InstanceType type) {
        if (cpus != null && type.cpus() < cpus) {
            return false;
        }
        if (memoryMib != null && type.memoryMib() < memoryMib) {
            return false;
        }
        if (gpus != null && type.gpus() < gpus) {
            return false;
        }
        return !interruptible || type.interruptible();
    }
}
