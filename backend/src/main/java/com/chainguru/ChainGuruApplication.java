package com.chainguru;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ChainGuruApplication {

    public static void main(String[] args) {
        SpringApplication.run(ChainGuruApplication.class, args);
    }
}
