package com.example.mlrundb;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MetadataDbApplication {

    public static void main(String[] args) {
        SpringApplication.run(MetadataDbApplication.class, args);
    }
}
