package com.jalarm;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class JalarmApplication {

    public static void main(String[] args) {
        SpringApplication.run(JalarmApplication.class, args);
    }
}
