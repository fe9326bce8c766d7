// Namespace
package com.gnovoa.tennis;

// Imports
import com.gnovoa.tennis.config.SchedulerProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/** The Main app */
@SpringBootApplication
@EnableConfigurationProperties(SchedulerProperties.class)
public class TennisSchedulerApplication {

  public static void main(String[] args) {
    SpringApplication.run(TennisSchedulerApplication.class, args);
  }
}
