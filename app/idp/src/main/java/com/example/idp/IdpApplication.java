package com.example.idp;

import com.example.common.config.TimeConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Import;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
@Import(TimeConfig.class)
public class IdpApplication {

  public static void main(String[] args) {
    SpringApplication.run(IdpApplication.class, args);
  }
}
