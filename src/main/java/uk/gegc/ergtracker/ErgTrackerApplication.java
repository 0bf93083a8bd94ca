package uk.gegc.ergtracker;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class ErgTrackerApplication {

    public static void main(String[] args) {
        SpringApplication.run(ErgTrackerApplication.class, args);
    }
}
