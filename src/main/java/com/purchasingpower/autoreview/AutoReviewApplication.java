package com.purchasingpower.autoreview;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AutoReviewApplication {

    public static void main(String[] args) {
        SpringApplication.run(AutoReviewApplication.class, args);
    }
}
