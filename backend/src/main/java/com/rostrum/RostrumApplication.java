package com.rostrum;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RostrumApplication {
    public static void main(String[] args) {
        SpringApplication.run(RostrumApplication.class, args);
    }
}
