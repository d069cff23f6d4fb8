package com.bifnet;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class XmlBifApplication {
    public static void main(String[] args) {
        SpringApplication.run(XmlBifApplication.class, args);
    }
}
