package com.bit.politeia;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@Slf4j
@SpringBootApplication(scanBasePackages = "com.bit.politeia")
public class PoliteiaApplication {
    public static void main(String[] args) {
        SpringApplication.run(PoliteiaApplication.class, args);
    }
}
