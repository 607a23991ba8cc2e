package com.kubeforge.orchestrator.setup;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kubeforge.orchestrator.api.SetupMonitor;
import com.kubeforge.orchestrator.model.ClusterDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;

/**
 * Runs a cluster setup once at startup when
 * {@code kubeforge.setup.cluster-definition} names a JSON cluster definition.
 *
 * The application keeps serving the status API after the run finishes.
 *
 * To run:
 *   mvn -pl orchestrator spring-boot:run \
 *     -Dspring-boot.run.arguments=--kubeforge.setup.cluster-definition=cluster.json
 */
@Component
public class ClusterSetupRunner implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(ClusterSetupRunner.class);

    private final KubeSetup    kubeSetup;
    private final SetupMonitor monitor;
    private final ObjectMapper objectMapper;
    private final String       definitionPath;

    public ClusterSetupRunner(KubeSetup kubeSetup,
                              SetupMonitor monitor,
                              ObjectMapper objectMapper,
                              @Value("${kubeforge.setup.cluster-definition:}") String definitionPath) {
        this.kubeSetup      = kubeSetup;
        this.monitor        = monitor;
        this.objectMapper   = objectMapper;
        this.definitionPath = definitionPath;
    }

    @Override
    public void run(String... args) {
        if (definitionPath == null || definitionPath.isBlank()) {
            log.info("No cluster definition configured; serving status API only");
            return;
        }

        ClusterDefinition cluster = loadDefinition(Path.of(definitionPath));
        SetupController<SetupContext> controller = kubeSetup.createSetupController(cluster);
        monitor.publish(controller);

        SetupRunResult result = controller.run();
        if (result.success()) {
            log.info("Cluster [{}] is ready ({} s)", cluster.name(), result.elapsed().toSeconds());
            return;
        }
        result.nodeFaults().forEach((node, fault) ->
                log.error("Node [{}] faulted in [{}]: {}", node, fault.step(), fault.message()));
        if (result.isAborted()) {
            log.error("Cluster [{}] setup failed at [{}]; run again to resume", cluster.name(), result.failedStep());
        } else {
            log.error("Cluster [{}] setup finished with {} faulted node(s); run again to retry them",
                    cluster.name(), result.nodeFaults().size());
        }
    }

    ClusterDefinition loadDefinition(Path path) {
        try {
            return objectMapper.copy()
                    .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                    .readValue(path.toFile(), ClusterDefinition.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read cluster definition " + path, e);
        }
    }
}
