package com.chambua.pricing;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class ChambuaPricingApplication {
    public static void main(String[] args) {
        SpringApplication.run(ChambuaPricingApplication.class, args);
    }
}
