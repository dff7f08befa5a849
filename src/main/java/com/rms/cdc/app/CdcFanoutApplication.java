package com.rms.cdc.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = "com.rms.cdc")
public class CdcFanoutApplication {

    public static void main(String[] args) {
        SpringApplication.run(CdcFanoutApplication.class, args);
    }
}
