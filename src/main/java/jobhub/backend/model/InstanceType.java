package jobhub.backend.model;

/**
 * A concrete compute shape offered by a backend.
 */
public record InstanceType(
        String name,
        int cpus,
        int memoryMib,
        int gpus,
        boolean interruptible) {
}
