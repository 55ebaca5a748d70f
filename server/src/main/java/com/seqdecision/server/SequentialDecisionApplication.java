package com.seqdecision.server;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SequentialDecisionApplication {

    public static void main(String[] args) {
        SpringApplication.run(SequentialDecisionApplication.class, args);
    }
}
