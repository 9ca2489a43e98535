package com.idiomchain;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class IdiomChainApplication {
  public static void main(String[] args) {
    SpringApplication.run(IdiomChainApplication.class, args);
  }
}
