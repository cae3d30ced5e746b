package com.delta.pagetracker;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class DeltaPageTrackerApplication {

  public static void main(String[] args) {
    SpringApplication.run(DeltaPageTrackerApplication.class, args);
  }
}
