package com.temperamentplatform.flags;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FlagServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(FlagServiceApplication.class, args);
    }
}
