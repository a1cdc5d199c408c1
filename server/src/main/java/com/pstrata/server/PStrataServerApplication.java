package com.pstrata.server;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PStrataServerApplication {

    public static void main(String[] args) {
        SpringApplication.run(PStrataServerApplication.class, args);
    }
}
