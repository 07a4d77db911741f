package com.example.storage;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TemporalStorageApplication {

    public static void main(String[] args) {
        SpringApplication.run(TemporalStorageApplication.class, args);
    }
}
