package com.scholary.mediascribe;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class MediaScribeApplication {

  public static void main(String[] args) {
    SpringApplication.run(MediaScribeApplication.class, args);
  }
}
