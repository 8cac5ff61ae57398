package com.example.profilestore;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class ProfileStoreApplication {

    public static void main(String[] args) {
        SpringApplication.run(ProfileStoreApplication.class, args);
    }
}
