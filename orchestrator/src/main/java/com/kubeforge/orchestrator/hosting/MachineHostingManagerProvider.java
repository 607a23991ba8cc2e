package com.kubeforge.orchestrator.hosting;

import com.kubeforge.orchestrator.model.ClusterDefinition;
import com.kubeforge.orchestrator.model.HostingEnvironment;
import org.springframework.stereotype.Component;

@Component
public class MachineHostingManagerProvider implements HostingManagerProvider {

    @Override
    public HostingEnvironment environment() {
        return HostingEnvironment.MACHINE;
    }

    @Override
    public HostingManager create(ClusterDefinition cluster) {
        return new MachineHostingManager();
    }
}
