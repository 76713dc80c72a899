package com.bottlespin;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BottleSpinApplication {
  public static void main(String[] args) {
    SpringApplication.run(BottleSpinApplication.class, args);
  }
}
