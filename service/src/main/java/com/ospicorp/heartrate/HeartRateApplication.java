package com.ospicorp.heartrate;

import com.ospicorp.heartrate.ingestion.pipeline.IngestionRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.event.ApplicationEnvironmentPreparedEvent;
import org.springframework.context.ApplicationListener;
import org.springframework.context.ConfigurableApplicationContext;

/**
 * Serves the query API by default. With {@code ingestion.enabled=true} the
 * process starts without a web server, performs one ingestion run and exits
 * with the run's status code.
 */
@SpringBootApplication
public class HeartRateApplication {

  public static void main(String[] args) {
    SpringApplication application = new SpringApplication(HeartRateApplication.class);
    application.addListeners(new IngestionModeListener());
    ConfigurableApplicationContext context = application.run(args);
    if (context.getBeanNamesForType(IngestionRunner.class).length > 0) {
      System.exit(SpringApplication.exit(context));
    }
  }

  static final class IngestionModeListener implements ApplicationListener<ApplicationEnvironmentPreparedEvent> {

    @Override
    public void onApplicationEvent(ApplicationEnvironmentPreparedEvent event) {
      if (event.getEnvironment().getProperty("ingestion.enabled", Boolean.class, false)) {
        event.getSpringApplication().setWebApplicationType(WebApplicationType.NONE);
      }
    }
  }
}
