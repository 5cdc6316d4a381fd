package jobhub.cloud.compute;

import jobhub.backend.config.BackendConfig;
import jobhub.backend.model.InstanceType;
import jobhub.backend.model.Job;
import yandex.cloud.api.compute.v1.InstanceOuterClass;          // SchedulingPolicy
import yandex.cloud.api.compute.v1.InstanceServiceOuterClass;   // Requests/Specs

import java.util.Locale;

/**
 * Builds the CreateInstanceRequest for one job from the backend settings and the
 * predicted instance type.
 */
public final class InstanceRequestBuilder {

    private static final long MIB = 1024L * 1024;
    private static final long GB = 1024L * 1024 * 1024;
    private static final int MAX_NAME_LENGTH = 63;

    private InstanceRequestBuilder() {}

    public static InstanceServiceOuterClass.CreateInstanceRequest build(BackendConfig cfg, Job job, InstanceType type) {
        // Resources (RAM in bytes)
        var resources = InstanceServiceOuterClass.ResourcesSpec.newBuilder()
                .setCores(type.cpus())
                .setMemory(type.memoryMib() * MIB)
                .setGpus(type.gpus())
                .build();

        // Boot disk
        var disk = InstanceServiceOuterClass.AttachedDiskSpec.DiskSpec.newBuilder()
                .setImageId(cfg.imageId())
                .setSize(cfg.diskGb() * GB)
                .build();

        var boot = InstanceServiceOuterClass.AttachedDiskSpec.newBuilder()
                .setAutoDelete(true)
                .setDiskSpec(disk)
                .build();

        // NIC, optional security group and public IP
        var nic = InstanceServiceOuterClass.NetworkInterfaceSpec.newBuilder()
                .setSubnetId(cfg.subnetId());
        if (cfg.securityGroupId() != null && !cfg.securityGroupId().isBlank()) {
            nic.addSecurityGroupIds(cfg.securityGroupId());
        }
        var addr = InstanceServiceOuterClass.PrimaryAddressSpec.newBuilder();
        if (cfg.assignPublicIp()) {
            addr.setOneToOneNatSpec(
                    InstanceServiceOuterClass.OneToOneNatSpec.newBuilder()
                            .setIpVersion(InstanceOuterClass.IpVersion.IPV4)
                            .build()
            );
        }
        nic.setPrimaryV4AddressSpec(addr.build());

        return InstanceServiceOuterClass.CreateInstanceRequest.newBuilder()
                .setFolderId(cfg.folderId())
                .setName(instanceName(job))
                .setZoneId(cfg.zoneId())
                .setPlatformId(cfg.platformId())
                .setResourcesSpec(resources)
                .setBootDiskSpec(boot)
                .addNetworkInterfaceSpecs(nic)
                .putLabels("jobhub-repo", labelValue(job.repoId()))
                .putLabels("jobhub-run", labelValue(job.runName()))
                .putLabels("jobhub-job", labelValue(job.jobId()))
                .putMetadata("user-data", CloudInitBuilder.buildUserData(cfg.sshUser(), cfg.sshPublicKey(), job))
                .setSchedulingPolicy(
                        InstanceOuterClass.SchedulingPolicy.newBuilder()
                                .setPreemptible(type.interruptible())
                                .build()
                )
                .build();
    }

    /** Instance names: lowercase letters, digits and hyphens, starting with a letter */
    static String instanceName(Job job) {
        String name = "jobhub-" + sanitize(job.jobId());
        if (name.length() > MAX_NAME_LENGTH) {
            name = name.substring(0, MAX_NAME_LENGTH);
        }
        return name.endsWith("-") ? name.substring(0, name.length() - 1) : name;
    }

    static String labelValue(String value) {
        String label = sanitize(value);
        return label.length() > MAX_NAME_LENGTH ? label.substring(0, MAX_NAME_LENGTH) : label;
    }

    private static String sanitize(String value) {
        return value.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9-]", "-");
    }
}
