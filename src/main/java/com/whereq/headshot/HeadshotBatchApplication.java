package com.whereq.headshot;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the headshot batch service.
 * Accepts batch generation jobs, queues them by priority and runs a bounded number of them
 * against the generation provider.
 *
 * @author WhereQ Inc.
 */
@SpringBootApplication
public class HeadshotBatchApplication {

    public static void main(String[] args) {
        SpringApplication.run(HeadshotBatchApplication.class, args);
    }
}
