package com.markethours;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MarketHoursApplication {

    public static void main(String[] args) {
        SpringApplication.run(MarketHoursApplication.class, args);
    }
}
