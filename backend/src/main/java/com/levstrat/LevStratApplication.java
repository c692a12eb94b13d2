package com.levstrat;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class LevStratApplication {

    public static void main(String[] args) {
        SpringApplication.run(LevStratApplication.class, args);
    }
}
