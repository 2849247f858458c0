package io.b2mash.b2b.gobdvault;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class GobdVaultApplication {

  public static void main(String[] args) {
    SpringApplication.run(GobdVaultApplication.class, args);
  }
}
