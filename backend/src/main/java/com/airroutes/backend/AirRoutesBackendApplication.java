package com.airroutes.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AirRoutesBackendApplication {

  public static void main(String[] args) {
    SpringApplication.run(AirRoutesBackendApplication.class, args);
  }
}
