package warmpool.cloud.config;

import warmpool.orchestrator.model.SubnetPlacement;

import java.util.ArrayList;
import java.util.List;

/**
 * Cloud account, placement and instance shape for the pool, loaded from INI.
 */
public class CloudConfig {

    // AUTH
    public String oauthToken;     // optional, falls back to OAUTH_TOKEN
    public String folderId;

    // NETWORK
    public List<SubnetPlacement> subnets = new ArrayList<>();
    public String securityGroupId;
    public boolean publicIp = false;

    // VM
    public String imageId;
    public String platformId = "standard-v3";
    public int cpu = 2;
    public int ramGb = 4;
    public int diskGb = 20;
    public boolean preemptible = false;

    // SSH
    public String sshUser;
    public String sshPublicKey;

    // ALB
    public String httpRouterId;
    public String virtualHost;    // shared host for path routing

    // AGENT
    public int agentPort = 8700;
    public String agentToken;     // optional

    public String oauthToken()                { return oauthToken; }
    public String folderId()                  { return folderId; }

    public List<SubnetPlacement> subnets()    { return subnets; }
    public String securityGroupId()           { return securityGroupId; }
    public boolean publicIp()                 { return publicIp; }

    public String imageId()                   { return imageId; }
    public String platformId()                { return platformId; }
    public int cpu()                          { return cpu; }
    public int ramGb()                        { return ramGb; }
    public int diskGb()                       { return diskGb; }
    public boolean preemptible()              { return preemptible; }

    public String sshUser()                   { return sshUser; }
    public String sshPublicKey()              { return sshPublicKey; }

    public String httpRouterId()              { return httpRouterId; }
    public String virtualHost()               { return virtualHost; }

    public int agentPort()                    { return agentPort; }
    public String agentToken()                { return agentToken; }

    @Override public String toString() {
        return "CloudConfig{" +
                "folderId='" + folderId + '\'' +
                ", subnets=" + subnets +
                ", platform='" + platformId + '\'' +
                ", cpu=" + cpu +
                ", ramGb=" + ramGb +
                ", httpRouterId='" + httpRouterId + '\'' +
                '}';
    }
}
