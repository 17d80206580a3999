package com.netaudit.topology;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class TopologyAuditorApplication {

  public static void main(String[] args) {
    SpringApplication.run(TopologyAuditorApplication.class, args);
  }
}
