package com.elssolution.motormonitor;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MotorMonitorApplication {

    public static void main(String[] args) {
        SpringApplication.run(MotorMonitorApplication.class, args);
    }

}
