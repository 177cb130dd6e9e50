package com.biai.explorer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BiaiExplorerApplication {

    public static void main(String[] args) {
        SpringApplication.run(BiaiExplorerApplication.class, args);
    }
}
