package com.bundleradar;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BundleRadarApplication {

    public static void main(String[] args) {
        SpringApplication.run(BundleRadarApplication.class, args);
    }
}
