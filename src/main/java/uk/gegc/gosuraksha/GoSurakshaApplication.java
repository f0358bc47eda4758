package uk.gegc.gosuraksha;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class GoSurakshaApplication {

    public static void main(String[] args) {
        SpringApplication.run(GoSurakshaApplication.class, args);
    }
}
