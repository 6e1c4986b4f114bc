package com.yoursp.xerosync;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class XeroSyncApplication {

    public static void main(String[] args) {
        SpringApplication.run(XeroSyncApplication.class, args);
    }
}
