package com.vidnyan.govern;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Govern - policy and compliance evaluation engine.
 *
 * Evaluates planned changes against policies and audits resource inventories
 * against control frameworks.
 */
@SpringBootApplication
public class GovernApplication {

    public static void main(String[] args) {
        SpringApplication.run(GovernApplication.class, args);
    }
}
