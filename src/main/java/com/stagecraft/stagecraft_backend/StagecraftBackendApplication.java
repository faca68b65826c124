package com.stagecraft.stagecraft_backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class StagecraftBackendApplication {

    public static void main(String[] args) {
        SpringApplication.run(StagecraftBackendApplication.class, args);
    }
}
