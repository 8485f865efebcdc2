package com.scholary.discussion;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;

@SpringBootApplication
@EnableAsync
public class DiscussionPipelineApplication {

  public static void main(String[] args) {
    SpringApplication.run(DiscussionPipelineApplication.class, args);
  }
}
