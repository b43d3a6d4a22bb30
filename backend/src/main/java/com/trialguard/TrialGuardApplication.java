package com.trialguard;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TrialGuardApplication {

    public static void main(String[] args) {
        SpringApplication.run(TrialGuardApplication.class, args);
    }
}
