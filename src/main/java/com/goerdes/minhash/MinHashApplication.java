package com.goerdes.minhash;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MinHashApplication {

    public static void main(String[] args) {
        SpringApplication.run(MinHashApplication.class, args);
    }

}
