package com.ospicorp.analyticsapi;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AnalyticsApiApplication {

  public static void main(String[] args) {
    SpringApplication.run(AnalyticsApiApplication.class, args);
  }
}
