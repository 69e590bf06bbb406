package com.roapid;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RoapidSyncApplication {

    public static void main(String[] args) {
        SpringApplication.run(RoapidSyncApplication.class, args);
    }
}
