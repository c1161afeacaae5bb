package com.txwatch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TxWatchApplication {

    public static void main(String[] args) {
        SpringApplication.run(TxWatchApplication.class, args);
    }
}
