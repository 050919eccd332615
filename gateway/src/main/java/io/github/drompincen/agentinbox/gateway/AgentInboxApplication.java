package io.github.drompincen.agentinbox.gateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.data.mongodb.repository.config.EnableMongoRepositories;

@SpringBootApplication(scanBasePackages = "io.github.drompincen.agentinbox")
@EnableMongoRepositories(basePackages = "io.github.drompincen.agentinbox.persistence.repository")
public class AgentInboxApplication {

    public static void main(String[] args) {
        SpringApplication.run(AgentInboxApplication.class, args);
    }
}
