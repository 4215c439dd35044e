package com.scholary.videoconcat;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableAsync;

@SpringBootApplication
@EnableAsync
public class VideoConcatApplication {

  public static void main(String[] args) {
    SpringApplication.run(VideoConcatApplication.class, args);
  }
}
