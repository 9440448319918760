package com.turnhub.turnservice;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TurnServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(TurnServiceApplication.class, args);
    }

}
