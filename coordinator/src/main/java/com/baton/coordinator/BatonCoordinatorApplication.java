package com.baton.coordinator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * To run:
 *   mvn -pl coordinator spring-boot:run
 *
 * The store lives under {@code coordinator.store-dir} (default: .baton in the
 * working directory).
 */
@SpringBootApplication
public class BatonCoordinatorApplication {

    public static void main(String[] args) {
        SpringApplication.run(BatonCoordinatorApplication.class, args);
    }
}
