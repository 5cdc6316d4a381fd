package jobhub.cloud.compute;

import com.google.protobuf.InvalidProtocolBufferException;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import jobhub.backend.compute.Compute;
import jobhub.backend.compute.ShellResult;
import jobhub.backend.config.BackendConfig;
import jobhub.backend.error.BackendException;
import jobhub.backend.error.BackendPermissionException;
import jobhub.backend.error.LaunchException;
import jobhub.backend.model.InstanceType;
import jobhub.backend.model.Job;
import jobhub.backend.model.RequestStatus;
import jobhub.backend.model.Requirements;
import jobhub.backend.util.Retry;
import jobhub.cloud.auth.AuthService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import yandex.cloud.api.compute.v1.InstanceOuterClass;
import yandex.cloud.api.compute.v1.InstanceServiceOuterClass;
import yandex.cloud.api.operation.OperationOuterClass;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;

/**
 * Compute on Yandex Cloud: one VM per job, the job's commands run by cloud-init at boot.
 * The request id is the instance id. Launch and terminate send the operation and return
 * without waiting for it to complete.
 */
public class YandexCompute implements Compute {

    private static final Logger log = LoggerFactory.getLogger(YandexCompute.class);

    static final int DEFAULT_CORES = 2;
    static final int DEFAULT_MEMORY_GB = 4;
    static final int MAX_CORES = 96;
    private static final Set<String> ALIVE = Set.of("PROVISIONING", "STARTING", "RUNNING", "RESTARTING", "UPDATING");

    private final AuthService auth;
    private final BackendConfig config;
    private final Retry retry;

    public YandexCompute(AuthService auth, BackendConfig config, Retry retry) {
        this.auth = auth;
        this.config = config;
        this.retry = retry;
    }

    @Override
    public Optional<InstanceType> predictInstanceType(Job job) {
        return predict(job.requirements(), config.platformId(), config.preemptible());
    }

    /**
     * Smallest shape of the platform covering the requirements: cores rounded up to an even
     * number, memory to whole GB, at least {@value #DEFAULT_CORES} cores and
     * {@value #DEFAULT_MEMORY_GB} GB. GPUs are not offered.
     */
    static Optional<InstanceType> predict(Requirements requirements, String platformId, boolean preemptible) {
        int cores = Math.max(DEFAULT_CORES, requirements.cpus() != null ? requirements.cpus() : 0);
        cores += cores % 2;
        int memoryGb = Math.max(DEFAULT_MEMORY_GB,
                requirements.memoryMib() != null ? (requirements.memoryMib() + 1023) / 1024 : 0);
        if (cores > MAX_CORES) {
            return Optional.empty();
        }
        InstanceType type = new InstanceType(
                platformId + "-" + cores + "c-" + memoryGb + "g" + (preemptible ? "-preemptible" : ""),
                cores, memoryGb * 1024, 0, preemptible);
        return requirements.isSatisfiedBy(type) ? Optional.of(type) : Optional.empty();
    }

    @Override
    public String launch(Job job, InstanceType instanceType) throws LaunchException {
        InstanceServiceOuterClass.CreateInstanceRequest req = InstanceRequestBuilder.build(config, job, instanceType);
        try {
            OperationOuterClass.Operation op = call("create instance for " + job.jobId(),
                    () -> auth.getInstanceService().create(req));
            String instanceId = op.getMetadata()
                    .unpack(InstanceServiceOuterClass.CreateInstanceMetadata.class)
                    .getInstanceId();
            log.info("Create sent: name={} id={} job={}", req.getName(), instanceId, job.jobId());
            return instanceId;
        } catch (StatusRuntimeException e) {
            Status.Code code = e.getStatus().getCode();
            if (code == Status.Code.RESOURCE_EXHAUSTED) {
                throw new LaunchException("No capacity for " + instanceType.name() + ": " + e.getMessage(),
                        RequestStatus.NO_CAPACITY, e);
            }
            throw translate("create instance for " + job.jobId(), e);
        } catch (InvalidProtocolBufferException e) {
            throw new BackendException("Unexpected create operation metadata for job " + job.jobId(), e);
        }
    }

    @Override
    public void terminate(String requestId) {
        var req = InstanceServiceOuterClass.DeleteInstanceRequest.newBuilder()
                .setInstanceId(requestId)
                .build();
        try {
            call("delete instance " + requestId, () -> auth.getInstanceService().delete(req));
            log.info("Delete sent: id={}", requestId);
        } catch (StatusRuntimeException e) {
            if (e.getStatus().getCode() == Status.Code.NOT_FOUND) {
                log.debug("Instance {} already gone", requestId);
                return;
            }
            throw translate("delete instance " + requestId, e);
        }
    }

    @Override
    public RequestStatus requestStatus(String requestId) {
        var req = InstanceServiceOuterClass.GetInstanceRequest.newBuilder()
                .setInstanceId(requestId)
                .build();
        try {
            InstanceOuterClass.Instance inst = call("get instance " + requestId,
                    () -> auth.getInstanceService().get(req));
            return toRequestStatus(inst.getStatus().toString());
        } catch (StatusRuntimeException e) {
            if (e.getStatus().getCode() == Status.Code.NOT_FOUND) {
                return RequestStatus.TERMINATED;
            }
            throw translate("get instance " + requestId, e);
        }
    }

    /** Not available: jobs run unattended through cloud-init */
    @Override
    public ShellResult runShell(String requestId, List<String> commands) {
        throw new UnsupportedOperationException("Remote shell is not supported on Yandex Cloud instances");
    }

    static RequestStatus toRequestStatus(String instanceStatus) {
        return ALIVE.contains(instanceStatus) ? RequestStatus.RUNNING : RequestStatus.TERMINATED;
    }

    static boolean isTransient(Throwable e) {
        if (!(e instanceof StatusRuntimeException sre)) {
            return false;
        }
        Status.Code code = sre.getStatus().getCode();
        return code == Status.Code.UNAVAILABLE || code == Status.Code.DEADLINE_EXCEEDED;
    }

    static BackendException translate(String operation, StatusRuntimeException e) {
        Status.Code code = e.getStatus().getCode();
        if (code == Status.Code.PERMISSION_DENIED || code == Status.Code.UNAUTHENTICATED) {
            return new BackendPermissionException("Not allowed to " + operation + ": " + e.getStatus().getDescription(), e);
        }
        return new BackendException("Failed to " + operation + ": " + e.getStatus(), e);
    }

    /** Run a gRPC call with retries on transient statuses; gRPC errors surface unchanged */
    private <T> T call(String operation, Callable<T> action) {
        try {
            return retry.call(operation, action, YandexCompute::isTransient);
        } catch (RuntimeException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BackendException("Interrupted while retrying " + operation, e);
        } catch (Exception e) {
            throw new BackendException("Failed to " + operation, e);
        }
    }
}
