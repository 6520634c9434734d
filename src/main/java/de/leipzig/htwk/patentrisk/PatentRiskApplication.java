package de.leipzig.htwk.patentrisk;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "de.leipzig.htwk.patentrisk")
public class PatentRiskApplication {
    public static void main(String[] args) {
        SpringApplication.run(PatentRiskApplication.class, args);
    }
}
