package com.example.access;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AccessPolicyApplication {

    public static void main(String[] args) {
        SpringApplication.run(AccessPolicyApplication.class, args);
    }

}
