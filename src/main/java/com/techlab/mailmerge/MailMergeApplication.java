package com.techlab.mailmerge;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MailMergeApplication {

    public static void main(String[] args) {
        SpringApplication.run(MailMergeApplication.class, args);
    }
}
