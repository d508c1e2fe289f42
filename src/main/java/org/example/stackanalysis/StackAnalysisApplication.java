package org.example.stackanalysis;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class StackAnalysisApplication {
    public static void main(String[] args) {
        SpringApplication.run(StackAnalysisApplication.class, args);
    }
}
