package com.support.triage.spring_server;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TriageServerApplication {

    public static void main(String[] args) {
        SpringApplication.run(TriageServerApplication.class, args);
    }
}
