package com.leanspec.sync.server;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = { "com.leanspec.sync.core", "com.leanspec.sync.server" })
public class SyncServerApplication {
    public static void main(String[] args) {
        SpringApplication.run(SyncServerApplication.class, args);
    }
}
