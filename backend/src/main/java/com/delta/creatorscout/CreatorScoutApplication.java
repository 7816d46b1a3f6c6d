package com.delta.creatorscout;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class CreatorScoutApplication {

  public static void main(String[] args) {
    SpringApplication.run(CreatorScoutApplication.class, args);
  }
}
