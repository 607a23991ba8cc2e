package com.kubeforge.orchestrator.hosting;

import com.kubeforge.orchestrator.model.ClusterDefinition;
import com.kubeforge.orchestrator.model.HostingEnvironment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * In-process lookup of hosting managers by environment.
 *
 * Every {@link HostingManagerProvider} bean is collected at startup via
 * constructor injection; supporting a new environment only requires
 * declaring another provider as a {@code @Component}.
 */
@Component
public class HostingManagerRegistry {

    private static final Logger log = LoggerFactory.getLogger(HostingManagerRegistry.class);

    private final Map<HostingEnvironment, HostingManagerProvider> providers = new EnumMap<>(HostingEnvironment.class);

    public HostingManagerRegistry(List<HostingManagerProvider> allProviders) {
        for (HostingManagerProvider provider : allProviders) {
            HostingManagerProvider previous = providers.put(provider.environment(), provider);
            if (previous != null) {
                throw new IllegalStateException("Two hosting manager providers for " + provider.environment()
                        + ": " + previous.getClass().getName() + ", " + provider.getClass().getName());
            }
            log.info("Registered hosting manager provider for {} ({})",
                    provider.environment(), provider.getClass().getSimpleName());
        }
    }

    /**
     * Creates the manager for the cluster's hosting environment and validates
     * the cluster against it.
     *
     * @throws HostingManagerNotFoundException when no provider handles the environment
     * @throws IllegalArgumentException        when the manager rejects the definition
     */
    public HostingManager getManager(ClusterDefinition cluster) {
        HostingManagerProvider provider = providers.get(cluster.hosting());
        if (provider == null) {
            throw new HostingManagerNotFoundException(cluster.hosting());
        }
        HostingManager manager = provider.create(cluster);
        try {
            manager.validate(cluster);
        } catch (RuntimeException e) {
            manager.close();
            throw e;
        }
        return manager;
    }

    public Set<HostingEnvironment> environments() {
        return Set.copyOf(providers.keySet());
    }
}
