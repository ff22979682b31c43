package com.ridehailing.fare;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FareEstimationServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(FareEstimationServiceApplication.class, args);
    }
}
