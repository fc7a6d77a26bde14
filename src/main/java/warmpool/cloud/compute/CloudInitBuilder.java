package warmpool.cloud.compute;

/**
 * Instance user-data: the SSH user plus the environment file the instance
 * agent reads at boot. Boot tooling on the image installs the workload,
 * writes the bootstrap secret and flips the {@code status} label to
 * {@code available}.
 */
public final class CloudInitBuilder {

    private CloudInitBuilder() {}

    public static String buildUserData(String user, String sshPublicKey, String poolName, int agentPort) {
        StringBuilder sb = new StringBuilder();
        sb.append("#cloud-config\n");
        sb.append("ssh_pwauth: no\n");
        sb.append("users:\n");
        sb.append("  - name: ").append(user).append("\n");
        sb.append("    sudo: ALL=(ALL) NOPASSWD:ALL\n");
        sb.append("    shell: /bin/bash\n");
        sb.append("    ssh_authorized_keys:\n");
        sb.append("      - ").append(sshPublicKey).append("\n");

        sb.append("write_files:\n");
        sb.append("  - path: /etc/default/pool-agent\n");
        sb.append("    permissions: '0644'\n");
        sb.append("    content: |\n");
        sb.append("      POOL_NAME=").append(poolName).append("\n");
        sb.append("      AGENT_PORT=").append(agentPort).append("\n");
        return sb.toString();
    }
}
