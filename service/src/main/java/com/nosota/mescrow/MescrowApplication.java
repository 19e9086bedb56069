package com.nosota.mescrow;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MescrowApplication {
    public static void main(String[] args) {
        SpringApplication.run(MescrowApplication.class, args);
    }
}
