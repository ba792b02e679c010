package com.aiadvent.ci;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CiAssistantApplication {

  public static void main(String[] args) {
    System.exit(SpringApplication.exit(SpringApplication.run(CiAssistantApplication.class, args)));
  }
}
