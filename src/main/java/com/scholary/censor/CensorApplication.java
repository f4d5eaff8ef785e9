package com.scholary.censor;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CensorApplication {

  public static void main(String[] args) {
    SpringApplication.run(CensorApplication.class, args);
  }
}
