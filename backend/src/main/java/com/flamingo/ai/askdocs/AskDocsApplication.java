package com.flamingo.ai.askdocs;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/** Entry point for the document question answering service. */
@SpringBootApplication
@EnableScheduling
public class AskDocsApplication {

  public static void main(String[] args) {
    SpringApplication.run(AskDocsApplication.class, args);
  }
}
