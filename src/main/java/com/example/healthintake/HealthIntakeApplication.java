package com.example.healthintake;

import com.example.healthintake.config.DangerCombinationProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(DangerCombinationProperties.class)
public class HealthIntakeApplication {

    public static void main(String[] args) {
        SpringApplication.run(HealthIntakeApplication.class, args);
    }
}
