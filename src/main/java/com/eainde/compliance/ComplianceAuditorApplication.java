package com.eainde.compliance;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ComplianceAuditorApplication {

    public static void main(String[] args) {
        SpringApplication.run(ComplianceAuditorApplication.class, args);
    }
}
