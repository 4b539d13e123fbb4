package com.numbertrack.backend;

import java.util.TimeZone;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Number lifecycle and verification service. Stays in the root package so component scanning reaches every module.
 */
@SpringBootApplication
public class BackendApplication {

    public static void main(String[] args) {
        // reclaim dates and token expiry are computed as UTC dates
        TimeZone.setDefault(TimeZone.getTimeZone("UTC"));
        SpringApplication.run(BackendApplication.class, args);
    }
}
