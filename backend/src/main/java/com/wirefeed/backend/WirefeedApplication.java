package com.wirefeed.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class WirefeedApplication {

    public static void main(String[] args) {
        SpringApplication.run(WirefeedApplication.class, args);
    }
}
