package com.linlay.agentstream;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class AgentStreamApplication {

    public static void main(String[] args) {
        SpringApplication.run(AgentStreamApplication.class, args);
    }
}
