package com.compareintel.compare;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CompareApiApplication {

    public static void main(String[] args) {
        SpringApplication.run(CompareApiApplication.class, args);
    }
}
