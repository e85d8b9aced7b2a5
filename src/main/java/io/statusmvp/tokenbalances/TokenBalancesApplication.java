package io.statusmvp.tokenbalances;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class TokenBalancesApplication {
  public static void main(String[] args) {
    SpringApplication.run(TokenBalancesApplication.class, args);
  }
}
