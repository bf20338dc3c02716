package com.delta.jobapplication;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class JobApplicationFormApplication {

  public static void main(String[] args) {
    SpringApplication.run(JobApplicationFormApplication.class, args);
  }
}
