package com.decisionplatform.orchestrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "com.decisionplatform")
public class DecisionOrchestratorApplication {

    public static void main(String[] args) {
        SpringApplication.run(DecisionOrchestratorApplication.class, args);
    }
}
