package com.aurelius;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AureliusApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(AureliusApplication.class, args)));
    }
}
