package com.hmmlab.server;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class HmmTrainerApplication {

    public static void main(String[] args) {
        SpringApplication.run(HmmTrainerApplication.class, args);
    }
}
