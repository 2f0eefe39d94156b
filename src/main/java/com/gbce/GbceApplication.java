package com.gbce;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class GbceApplication {

    public static void main(String[] args) {
        SpringApplication.run(GbceApplication.class, args);
    }
}
