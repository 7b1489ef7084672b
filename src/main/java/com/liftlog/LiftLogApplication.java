package com.liftlog;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LiftLogApplication {

    public static void main(String[] args) {
        SpringApplication.run(LiftLogApplication.class, args);
    }
}
