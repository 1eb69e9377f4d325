package com.loanmatch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LoanMatchApplication {

    public static void main(String[] args) {
        SpringApplication.run(LoanMatchApplication.class, args);
    }
}
