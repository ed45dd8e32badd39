package com.healthtwin;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class HealthTwinApplication {

    public static void main(String[] args) {
        SpringApplication.run(HealthTwinApplication.class, args);
    }
}
