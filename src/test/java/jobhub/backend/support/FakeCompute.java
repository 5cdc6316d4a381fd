package jobhub.backend.support;

import jobhub.backend.compute.Compute;
import jobhub.backend.compute.ShellResult;
import jobhub.backend.error.LaunchException;
import jobhub.backend.model.InstanceType;
import jobhub.backend.model.Job;
import jobhub.backend.model.RequestStatus;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Compute double: requests live in a map, tests flip their status.
 */
public class FakeCompute implements Compute {

    public static final InstanceType SMALL = new InstanceType("small", 2, 4096, 0, false);
    public static final InstanceType GPU = new InstanceType("gpu", 8, 32768, 1, true);

    private final List<InstanceType> catalog = new ArrayList<>(List.of(SMALL, GPU));
    private final Map<String, RequestStatus> requests = new ConcurrentHashMap<>();
    private final List<String> terminated = new ArrayList<>();
    private final AtomicInteger counter = new AtomicInteger();
    private volatile boolean noCapacity;
    private volatile boolean statusCheckFails;
    private volatile boolean keepAliveOnTerminate;

    public FakeCompute withNoCapacity(boolean noCapacity) {
        this.noCapacity = noCapacity;
        return this;
    }

    public FakeCompute withStatusCheckFailing(boolean fails) {
        this.statusCheckFails = fails;
        return this;
    }

    /** Terminated requests stay alive until {@link #setStatus} is called (slow shutdown) */
    public FakeCompute withKeepAliveOnTerminate(boolean keepAlive) {
        this.keepAliveOnTerminate = keepAlive;
        return this;
    }

    public void setStatus(String requestId, RequestStatus status) {
        requests.put(requestId, status);
    }

    public synchronized List<String> terminated() {
        return List.copyOf(terminated);
    }

    @Override
    public Optional<InstanceType> predictInstanceType(Job job) {
        return catalog.stream().filter(t -> job.requirements().isSatisfiedBy(t)).findFirst();
    }

    @Override
    public String launch(Job job, InstanceType instanceType) throws LaunchException {
        if (noCapacity) {
            throw new LaunchException("no capacity", RequestStatus.NO_CAPACITY);
        }
        String requestId = "req-" + counter.incrementAndGet();
        requests.put(requestId, RequestStatus.RUNNING);
        return requestId;
    }

    @Override
    public synchronized void terminate(String requestId) {
        terminated.add(requestId);
        if (!keepAliveOnTerminate) {
            requests.put(requestId, RequestStatus.TERMINATED);
        }
    }

    @Override
    public RequestStatus requestStatus(String requestId) {
        if (statusCheckFails) {
            throw new IllegalStateException("provider unavailable");
        }
        return requests.getOrDefault(requestId, RequestStatus.TERMINATED);
    }

    @Override
    public ShellResult runShell(String requestId, List<String> commands) {
        return new ShellResult(0, String.join("\n", commands));
    }
}
