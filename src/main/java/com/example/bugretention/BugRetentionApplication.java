package com.example.bugretention;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BugRetentionApplication {

    public static void main(String[] args) {
        SpringApplication.run(BugRetentionApplication.class, args);
    }
}
