package warmpool.cloud.compute;

import warmpool.cloud.config.CloudConfig;
import warmpool.orchestrator.model.LaunchSpec;
import yandex.cloud.api.compute.v1.InstanceOuterClass;
import yandex.cloud.api.compute.v1.InstanceServiceOuterClass;

/**
 * Builds the create request for one pool instance from the cloud config and
 * a per-launch placement.
 */
public class InstanceRequestBuilder {

    private static final long GB = 1024L * 1024 * 1024;

    public static InstanceServiceOuterClass.CreateInstanceRequest build(CloudConfig cfg, LaunchSpec spec,
                                                                        String userData) {
        var resources = InstanceServiceOuterClass.ResourcesSpec.newBuilder()
                .setCores(cfg.cpu())
                .setMemory(cfg.ramGb() * GB)
                .build();

        var disk = InstanceServiceOuterClass.AttachedDiskSpec.DiskSpec.newBuilder()
                .setImageId(cfg.imageId())
                .setSize(cfg.diskGb() * GB)
                .build();

        var boot = InstanceServiceOuterClass.AttachedDiskSpec.newBuilder()
                .setAutoDelete(true)
                .setDiskSpec(disk)
                .build();

        var nic = InstanceServiceOuterClass.NetworkInterfaceSpec.newBuilder()
                .setSubnetId(spec.subnetId());

        if (cfg.securityGroupId() != null && !cfg.securityGroupId().isBlank()) {
            nic.addSecurityGroupIds(cfg.securityGroupId());
        }

        var addr = InstanceServiceOuterClass.PrimaryAddressSpec.newBuilder();
        if (cfg.publicIp()) {
            addr.setOneToOneNatSpec(
                    InstanceServiceOuterClass.OneToOneNatSpec.newBuilder()
                            .setIpVersion(InstanceOuterClass.IpVersion.IPV4)
                            .build()
            );
        }
        nic.setPrimaryV4AddressSpec(addr.build());

        return InstanceServiceOuterClass.CreateInstanceRequest.newBuilder()
                .setFolderId(cfg.folderId())
                .setName(spec.name())
                .setZoneId(spec.zoneId())
                .setPlatformId(cfg.platformId())
                .setResourcesSpec(resources)
                .setBootDiskSpec(boot)
                .addNetworkInterfaceSpecs(nic)
                .putAllLabels(spec.labels())
                .putMetadata("user-data", userData)
                .setSchedulingPolicy(
                        InstanceOuterClass.SchedulingPolicy.newBuilder()
                                .setPreemptible(cfg.preemptible())
                                .build()
                )
                .build();
    }
}
