package com.flightops.diversion;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class DiversionServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(DiversionServiceApplication.class, args);
    }
}
