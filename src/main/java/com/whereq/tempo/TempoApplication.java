package com.whereq.tempo;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for WhereQ Tempo.
 * This service schedules one-shot background jobs, tracks their lifecycle
 * in a relational table and notifies an external endpoint on completion.
 *
 * @author WhereQ Inc.
 */
@SpringBootApplication
public class TempoApplication {

    public static void main(String[] args) {
        SpringApplication.run(TempoApplication.class, args);
    }
}
