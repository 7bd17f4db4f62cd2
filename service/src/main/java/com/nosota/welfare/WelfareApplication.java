package com.nosota.welfare;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class WelfareApplication {
    public static void main(String[] args) {
        SpringApplication.run(WelfareApplication.class, args);
    }
}
