package com.example.healthrag;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class HealthRagApplication {

    public static void main(String[] args) {
        SpringApplication.run(HealthRagApplication.class, args);
    }
}
