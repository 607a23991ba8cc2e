package com.kubeforge.orchestrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class KubeForgeApplication {

    public static void main(String[] args) {
        SpringApplication.run(KubeForgeApplication.class, args);
    }
}
