package com.agentcrew.orchestrator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AgentCrewOrchestratorApplication {

    public static void main(String[] args) {
        SpringApplication.run(AgentCrewOrchestratorApplication.class, args);
    }
}
