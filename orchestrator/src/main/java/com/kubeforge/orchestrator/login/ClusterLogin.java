package com.kubeforge.orchestrator.login;

import com.kubeforge.orchestrator.model.ClusterDefinition;

/**
 * Everything needed to reach a cluster after setup, plus the in-progress
 * setup state. Persisted as JSON by {@link ClusterLoginStore}.
 *
 * Steps on different threads mutate the same instance; callers serialize
 * writes through {@link ClusterLoginStore#save}.
 */
public class ClusterLogin {

    private String            clusterName;
    private ClusterDefinition clusterDefinition;
    private String            sshUsername;
    private String            sshPassword;
    private SshKeyPair        sshKey;
    private SetupDetails      setupDetails = new SetupDetails();

    public ClusterLogin() {}   // Jackson

    public ClusterLogin(ClusterDefinition clusterDefinition, String sshUsername) {
        this.clusterName       = clusterDefinition.name();
        this.clusterDefinition = clusterDefinition;
        this.sshUsername       = sshUsername;
    }

    public String            getClusterName()       { return clusterName; }
    public ClusterDefinition getClusterDefinition() { return clusterDefinition; }
    public String            getSshUsername()       { return sshUsername; }
    public String            getSshPassword()       { return sshPassword; }
    public SshKeyPair        getSshKey()            { return sshKey; }
    public SetupDetails      getSetupDetails()      { return setupDetails; }

    public void setClusterName(String v)                  { this.clusterName = v; }
    public void setClusterDefinition(ClusterDefinition v) { this.clusterDefinition = v; }
    public void setSshUsername(String v)                  { this.sshUsername = v; }
    public void setSshPassword(String v)                  { this.sshPassword = v; }
    public void setSshKey(SshKeyPair v)                   { this.sshKey = v; }
    public void setSetupDetails(SetupDetails v)           { this.setupDetails = v == null ? new SetupDetails() : v; }
}
