package com.slwatchdog;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class SlWatchdogApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(SlWatchdogApplication.class, args)));
    }
}
