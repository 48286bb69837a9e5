package com.flagship.transfer_engine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TransferEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(TransferEngineApplication.class, args);
    }
}
