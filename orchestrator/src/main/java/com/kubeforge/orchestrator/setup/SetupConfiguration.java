package com.kubeforge.orchestrator.setup;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.kubeforge.orchestrator.login.ClusterLoginStore;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Duration;

@Configuration
public class SetupConfiguration {

    @Bean
    SetupSettings setupSettings(
            @Value("${kubeforge.setup.max-parallel:500}") int maxParallel,
            @Value("${kubeforge.setup.wait-until-online-timeout:15m}") Duration waitUntilOnlineTimeout,
            @Value("${kubeforge.setup.online-poll-interval:5s}") Duration onlinePollInterval,
            @Value("${kubeforge.setup.join-max-attempts:10}") int joinMaxAttempts,
            @Value("${kubeforge.setup.join-retry-delay:5s}") Duration joinRetryDelay,
            @Value("${kubeforge.setup.cluster-op-timeout:10m}") Duration clusterOpTimeout,
            @Value("${kubeforge.setup.cluster-op-poll-interval:5s}") Duration clusterOpPollInterval,
            @Value("${kubeforge.setup.login-folder:${user.home}/.kubeforge/logins}") Path loginFolder,
            @Value("${kubeforge.setup.log-folder:${user.home}/.kubeforge/logs}") Path logFolder) {
        return new SetupSettings(maxParallel, waitUntilOnlineTimeout, onlinePollInterval,
                joinMaxAttempts, joinRetryDelay, clusterOpTimeout, clusterOpPollInterval,
                loginFolder, logFolder);
    }

    @Bean
    ClusterLoginStore clusterLoginStore(SetupSettings settings, ObjectMapper objectMapper) {
        return new ClusterLoginStore(settings.loginFolder(), objectMapper);
    }

    @Bean
    PrivilegeCheck privilegeCheck() {
        return PrivilegeCheck.CURRENT_USER;
    }
}
