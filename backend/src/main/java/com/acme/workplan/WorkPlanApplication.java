package com.acme.workplan;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class WorkPlanApplication {
    public static void main(String[] args) {
        SpringApplication.run(WorkPlanApplication.class, args);
    }
}
