package com.linkdrop.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class LinkDropApplication {

    public static void main(String[] args) {
        SpringApplication.run(LinkDropApplication.class, args);
    }

}
