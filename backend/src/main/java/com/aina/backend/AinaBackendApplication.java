package com.aina.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AinaBackendApplication {

  public static void main(String[] args) {
    SpringApplication.run(AinaBackendApplication.class, args);
  }
}
