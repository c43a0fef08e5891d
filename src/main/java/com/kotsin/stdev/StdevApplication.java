package com.kotsin.stdev;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Spring Boot application running resumable rolling stdev batches.
 */
@SpringBootApplication
public class StdevApplication {

    public static void main(String[] args) {
        SpringApplication.run(StdevApplication.class, args);
    }
}
