package com.marketalert.scheduler;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "com.marketalert")
public class MarketAlertApplication {

    public static void main(String[] args) {
        SpringApplication.run(MarketAlertApplication.class, args);
    }
}
