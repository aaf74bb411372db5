package io.github.drompincen.crewflow.gateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.data.mongodb.repository.config.EnableMongoRepositories;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication(scanBasePackages = "io.github.drompincen.crewflow")
@EnableMongoRepositories(basePackages = "io.github.drompincen.crewflow.persistence.repository")
@EnableScheduling
public class CrewflowApplication {

    public static void main(String[] args) {
        SpringApplication.run(CrewflowApplication.class, args);
    }
}
