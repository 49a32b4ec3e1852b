package com.flagship.leave_audit;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class LeaveAuditApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(LeaveAuditApplication.class, args)));
    }
}
