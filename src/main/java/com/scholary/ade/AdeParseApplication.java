package com.scholary.ade;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class AdeParseApplication {

  public static void main(String[] args) {
    SpringApplication.run(AdeParseApplication.class, args);
  }
}
