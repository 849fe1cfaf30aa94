package com.hagglehub.gateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "com.hagglehub")
public class HaggleHubApp {

    public static void main(String[] args) {
        SpringApplication.run(HaggleHubApp.class, args);
    }
}
