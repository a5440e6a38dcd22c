package io.b2mash.b2b.artifactvault;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class ArtifactVaultApplication {

  public static void main(String[] args) {
    SpringApplication.run(ArtifactVaultApplication.class, args);
  }
}
