package com.kubeforge.orchestrator.hosting;

import com.kubeforge.orchestrator.model.HostingEnvironment;

public class HostingManagerNotFoundException extends RuntimeException {
    public HostingManagerNotFoundException(HostingEnvironment environment) {
        super("No hosting manager for the [" + environment + "] environment could be located.");
    }
}
