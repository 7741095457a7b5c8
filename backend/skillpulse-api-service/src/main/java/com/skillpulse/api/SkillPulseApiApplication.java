package com.skillpulse.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication(scanBasePackages = "com.skillpulse")
@EnableScheduling
public class SkillPulseApiApplication {
  public static void main(String[] args) {
    SpringApplication.run(SkillPulseApiApplication.class, args);
  }
}
