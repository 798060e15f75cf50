package com.eainde.extraction;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class EntityExtractionApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(EntityExtractionApplication.class, args)));
    }
}
