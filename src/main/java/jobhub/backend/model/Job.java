package jobhub.backend.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable domain model of one schedulable unit of compute work.
 * The definition part (image, commands, requirements, artifacts, apps) never
 * changes after submission; lifecycle fields change through {@link #toBuilder()}
 * or {@link #withStatus(JobStatus, Instant)}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonDeserialize(builder = Job.Builder.class)
public final class Job {
    private final String jobId;
    private final String repoId;
    private final String runName;
    private final String hubUserName;
    private final String workflowName;
    private final String providerName;

    // Definition
    private final String imageName;
    private final List<String> commands;
    private final List<String> entrypoint;
    private final Map<String, String> env;
    private final String workingDir;
    private final Requirements requirements;
    private final List<ArtifactSpec> artifactSpecs;
    private final List<AppSpec> appSpecs;
    private final List<String> buildCommands;

    // Lifecycle
    private final JobStatus status;
    private final JobErrorCode errorCode;
    private final Integer containerExitCode;
    private final Instant submittedAt;
    private final String requestId;
    private final InstanceType instanceType;
    private final String tagName;
    private final List<StatusTransition> transitions;

    private Job(Builder builder) {
        this.jobId = Objects.requireNonNull(builder.jobId, "jobId is required");
        this.repoId = Objects.requireNonNull(builder.repoId, "repoId is required");
        this.runName = Objects.requireNonNull(builder.runName, "runName is required");
        this.hubUserName = builder.hubUserName;
        this.workflowName = builder.workflowName;
        this.providerName = builder.providerName;
        this.imageName = builder.imageName;
        this.commands = List.copyOf(builder.commands);
        this.entrypoint = builder.entrypoint == null ? null : List.copyOf(builder.entrypoint);
        this.env = Map.copyOf(builder.env);
        this.workingDir = builder.workingDir;
        this.requirements = builder.requirements != null ? builder.requirements : Requirements.none();
        this.artifactSpecs = List.copyOf(builder.artifactSpecs);
        this.appSpecs = List.copyOf(builder.appSpecs);
        this.buildCommands = List.copyOf(builder.buildCommands);
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.errorCode = builder.errorCode;
        this.containerExitCode = builder.containerExitCode;
        this.submittedAt = builder.submittedAt;
        this.requestId = builder.requestId;
        this.instanceType = builder.instanceType;
        this.tagName = builder.tagName;
        this.transitions = List.copyOf(builder.transitions);
    }

    @JsonProperty("jobId")
    public String jobId() {
        return jobId;
    }

    @JsonProperty("repoId")
    public String repoId() {
        return repoId;
    }

    @JsonProperty("runName")
    public String runName() {
        return runName;
    }

    @JsonProperty("hubUserName")
    public String hubUserName() {
        return hubUserName;
    }

    @JsonProperty("workflowName")
    public String workflowName() {
        return workflowName;
    }

    @JsonProperty("providerName")
    public String providerName() {
        return providerName;
    }

    @JsonProperty("imageName")
    public String imageName() {
        return imageName;
    }

    @JsonProperty("commands")
    public List<String> commands() {
        return commands;
    }

    @JsonProperty("entrypoint")
    public List<String> entrypoint() {
        return entrypoint;
    }

    @JsonProperty("env")
    public Map<String, String> env() {
        return env;
    }

    @JsonProperty("workingDir")
    public String workingDir() {
        return workingDir;
    }

    @JsonProperty("requirements")
    public Requirements requirements() {
        return requirements;
    }

    @JsonProperty("artifactSpecs")
    public List<ArtifactSpec> artifactSpecs() {
        return artifactSpecs;
    }

    @JsonProperty("appSpecs")
    public List<AppSpec> appSpecs() {
        return appSpecs;
    }

    @JsonProperty("buildCommands")
    public List<String> buildCommands() {
        return buildCommands;
    }

    @JsonProperty("status")
    public JobStatus status() {
        return status;
    }

    @JsonProperty("errorCode")
    public JobErrorCode errorCode() {
        return errorCode;
    }

    @JsonProperty("containerExitCode")
    public Integer containerExitCode() {
        return containerExitCode;
    }

    @JsonProperty("submittedAt")
    public Instant submittedAt() {
        return submittedAt;
    }

    @JsonProperty("requestId")
    public String requestId() {
        return requestId;
    }

    @JsonProperty("instanceType")
    public InstanceType instanceType() {
        return instanceType;
    }

    @JsonProperty("tagName")
    public String tagName() {
        return tagName;
    }

    @JsonProperty("transitions")
    public List<StatusTransition> transitions() {
        return transitions;
    }

    @JsonIgnore
    public boolean isTerminal() {
        return status.isTerminal();
    }

    /**
     * Move to a new status, recording the transition.
     *
     * @throws IllegalStateException if the transition graph does not allow the move
     */
    public Job withStatus(JobStatus newStatus, Instant at) {
        if (newStatus == status) {
            return this;
        }
        if (!status.canTransitionTo(newStatus)) {
            throw new IllegalStateException(
                    "Job " + jobId + " cannot move from " + status + " to " + newStatus);
        }
        return toBuilder()
                .status(newStatus)
                .addTransition(new StatusTransition(newStatus, at))
                .build();
    }

    /** Lightweight index entry for this job */
    public JobHead head() {
        return new JobHead(
                jobId,
                repoId,
                runName,
                workflowName,
                providerName,
                hubUserName,
                status,
                errorCode,
                submittedAt,
                requestId,
                instanceType != null ? instanceType.name() : null,
                artifactSpecs.stream().map(ArtifactSpec::artifactPath).toList(),
                appSpecs.stream().map(AppSpec::appName).toList(),
                tagName);
    }

    /** Create a builder from this job (for updates) */
    public Builder toBuilder() {
        return new Builder()
                .jobId(jobId)
                .repoId(repoId)
                .runName(runName)
                .hubUserName(hubUserName)
                .workflowName(workflowName)
                .providerName(providerName)
                .imageName(imageName)
                .commands(commands)
                .entrypoint(entrypoint)
                .env(env)
                .workingDir(workingDir)
                .requirements(requirements)
                .artifactSpecs(artifactSpecs)
                .appSpecs(appSpecs)
                .buildCommands(buildCommands)
                .status(status)
                .errorCode(errorCode)
                .containerExitCode(containerExitCode)
                .submittedAt(submittedAt)
                .requestId(requestId)
                .instanceType(instanceType)
                .tagName(tagName)
                .transitions(transitions);
    }

    public static Builder builder() {
        return new Builder();
    }

    @JsonPOJOBuilder(withPrefix = "")
    public static final class Builder {
        private String jobId;
        private String repoId;
        private String runName;
        private String hubUserName;
        private String workflowName;
        private String providerName;
        private String imageName;
        private List<String> commands = List.of();
        private List<String> entrypoint;
        private Map<String, String> env = Map.of();
        private String workingDir;
        private Requirements requirements;
        private List<ArtifactSpec> artifactSpecs = List.of();
        private List<AppSpec> appSpecs = List.of();
        private List<String> buildCommands = List.of();
        private JobStatus status = JobStatus.SUBMITTED;
        private JobErrorCode errorCode;
        private Integer containerExitCode;
        private Instant submittedAt;
        private String requestId;
        private InstanceType instanceType;
        private String tagName;
        private List<StatusTransition> transitions = new ArrayList<>();

        public Builder jobId(String jobId) {
            this.jobId = jobId;
            return this;
        }

        public Builder repoId(String repoId) {
            this.repoId = repoId;
            return this;
        }

        public Builder runName(String runName) {
            this.runName = runName;
            return this;
        }

        public Builder hubUserName(String hubUserName) {
            this.hubUserName = hubUserName;
            return this;
        }

        public Builder workflowName(String workflowName) {
            this.workflowName = workflowName;
            return this;
        }

        public Builder providerName(String providerName) {
            this.providerName = providerName;
            return this;
        }

        public Builder imageName(String imageName) {
            this.imageName = imageName;
            return this;
        }

        public Builder commands(List<String> commands) {
            this.commands = commands != null ? commands : List.of();
            return this;
        }

        public Builder entrypoint(List<String> entrypoint) {
            this.entrypoint = entrypoint;
            return this;
        }

        public Builder env(Map<String, String> env) {
            this.env = env != null ? env : Map.of();
            return this;
        }

        public Builder workingDir(String workingDir) {
            this.workingDir = workingDir;
            return this;
        }

        public Builder requirements(Requirements requirements) {
            this.requirements = requirements;
            return this;
        }

        public Builder artifactSpecs(List<ArtifactSpec> artifactSpecs) {
            this.artifactSpecs = artifactSpecs != null ? artifactSpecs : List.of();
            return this;
        }

        public Builder appSpecs(List<AppSpec> appSpecs) {
            this.appSpecs = appSpecs != null ? appSpecs : List.of();
            return this;
        }

        public Builder buildCommands(List<String> buildCommands) {
            this.buildCommands = buildCommands != null ? buildCommands : List.of();
            return this;
        }

        public Builder status(JobStatus status) {
            this.status = status;
            return this;
        }

        public Builder errorCode(JobErrorCode errorCode) {
            this.errorCode = errorCode;
            return this;
        }

        public Builder containerExitCode(Integer containerExitCode) {
            this.containerExitCode = containerExitCode;
            return this;
        }

        public Builder submittedAt(Instant submittedAt) {
            this.submittedAt = submittedAt;
            return this;
        }

        public Builder requestId(String requestId) {
            this.requestId = requestId;
            return this;
        }

        public Builder instanceType(InstanceType instanceType) {
            this.instanceType = instanceType;
            return this;
        }

        public Builder tagName(String tagName) {
            this.tagName = tagName;
            return this;
        }

        public Builder transitions(List<StatusTransition> transitions) {
            this.transitions = transitions != null ? new ArrayList<>(transitions) : new ArrayList<>();
            return this;
        }

        public Builder addTransition(StatusTransition transition) {
            this.transitions.add(transition);
            return this;
        }

        public Job build() {
            return new Job(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Job job))
            return false;
        return Objects.equals(repoId, job.repoId) && Objects.equals(jobId, job.jobId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(repoId, jobId);
    }

    @Override
    public String toString() {
        return "Job{id='" + jobId + "', run='" + runName + "', status=" + status + "}";
    }
}
