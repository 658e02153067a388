package com.example.baselinediff;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@ConfigurationPropertiesScan
@EnableScheduling
public class BaselineDiffServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(BaselineDiffServiceApplication.class, args);
    }
}
