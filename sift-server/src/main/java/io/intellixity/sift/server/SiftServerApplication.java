package io.intellixity.sift.server;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;

@SpringBootApplication(exclude = {DataSourceAutoConfiguration.class})
public class SiftServerApplication {
  public static void main(String[] args) {
    SpringApplication.run(SiftServerApplication.class, args);
  }
}
