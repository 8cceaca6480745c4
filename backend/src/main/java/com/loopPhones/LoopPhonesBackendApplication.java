package com.loopPhones;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LoopPhonesBackendApplication {

    public static void main(String[] args) {
        SpringApplication.run(LoopPhonesBackendApplication.class, args);
    }

}
