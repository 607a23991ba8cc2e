package com.kubeforge.orchestrator.login;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Setup state that must survive a crashed or interrupted run.
 */
public class SetupDetails {

    // True until the final setup step completes; a pending login is resumed.
    private boolean setupPending = true;

    // Extracted from the "kubeadm init" output on the first control-plane node.
    private String clusterJoinCommand;

    // Path -> file, downloaded from the first control-plane node.
    private Map<String, RemoteFileDetails> controlPlaneFiles = new LinkedHashMap<>();

    // StepKey.toString() of every completed step, used to seed the registry on resume.
    private List<String> completedSteps = new ArrayList<>();

    public boolean isSetupPending()                    { return setupPending; }
    public void    setSetupPending(boolean v)          { this.setupPending = v; }
    public String  getClusterJoinCommand()             { return clusterJoinCommand; }
    public void    setClusterJoinCommand(String v)     { this.clusterJoinCommand = v; }

    public Map<String, RemoteFileDetails> getControlPlaneFiles() { return controlPlaneFiles; }
    public void setControlPlaneFiles(Map<String, RemoteFileDetails> v) {
        this.controlPlaneFiles = v == null ? new LinkedHashMap<>() : new LinkedHashMap<>(v);
    }

    public List<String> getCompletedSteps() { return completedSteps; }
    public void setCompletedSteps(List<String> v) {
        this.completedSteps = v == null ? new ArrayList<>() : new ArrayList<>(v);
    }
}
