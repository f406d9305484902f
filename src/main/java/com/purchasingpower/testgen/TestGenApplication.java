package com.purchasingpower.testgen;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TestGenApplication {

    public static void main(String[] args) {
        SpringApplication.run(TestGenApplication.class, args);
    }
}
