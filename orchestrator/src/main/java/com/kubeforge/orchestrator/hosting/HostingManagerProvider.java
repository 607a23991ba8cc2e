package com.kubeforge.orchestrator.hosting;

import com.kubeforge.orchestrator.model.ClusterDefinition;
import com.kubeforge.orchestrator.model.HostingEnvironment;

/**
 * Creates {@link HostingManager}s for one environment. Declare implementations
 * as Spring components to make them available to {@link HostingManagerRegistry}.
 */
public interface HostingManagerProvider {

    HostingEnvironment environment();

    HostingManager create(ClusterDefinition cluster);
}
