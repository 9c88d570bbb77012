package org.kioskfleet;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class FleetServerApplication {
    public static void main(String[] args) {
        SpringApplication.run(FleetServerApplication.class, args);
    }
}
