package uk.gegc.covenhub;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class CovenHubApplication {

    public static void main(String[] args) {
        SpringApplication.run(CovenHubApplication.class, args);
    }
}
