package com.fractionax.propertyEngine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PropertyEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(PropertyEngineApplication.class, args);
    }
}
