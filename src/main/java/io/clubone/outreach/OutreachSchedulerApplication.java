package io.clubone.outreach;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.security.oauth2.resource.servlet.OAuth2ResourceServerAutoConfiguration;
import org.springframework.retry.annotation.EnableRetry;

@SpringBootApplication(exclude = {
    OAuth2ResourceServerAutoConfiguration.class  // Exclude by default, enable via SecurityConfig when needed
})
@EnableRetry
public class OutreachSchedulerApplication {
  public static void main(String[] args) {
    SpringApplication.run(OutreachSchedulerApplication.class, args);
  }
}
