package jobhub.backend.compute;

import jobhub.backend.error.LaunchException;
import jobhub.backend.model.InstanceType;
import jobhub.backend.model.Job;
import jobhub.backend.model.RequestStatus;

import java.util.List;
import java.util.Optional;

/**
 * Provisions and controls the compute a job runs on.
 * A launched job is identified by an opaque request id chosen by the implementation.
 */
public interface Compute {

    /**
     * Cheapest instance type of this backend satisfying the job's requirements.
     *
     * @return empty when nothing matches
     */
    Optional<InstanceType> predictInstanceType(Job job);

    /**
     * Start the job on a new instance of the given type. Returns without waiting for the
     * job to run.
     *
     * @return the request id
     * @throws LaunchException when the provider could not provision the instance
     */
    String launch(Job job, InstanceType instanceType) throws LaunchException;

    /** Release the request. Terminating a request that is already gone is a no-op. */
    void terminate(String requestId);

    RequestStatus requestStatus(String requestId);

    default boolean isAlive(String requestId) {
        return requestStatus(requestId) == RequestStatus.RUNNING;
    }

    /**
     * Run shell commands on the instance of a live request.
     *
     * @throws UnsupportedOperationException when the backend cannot execute remotely
     */
    ShellResult runShell(String requestId, List<String> commands);
}
