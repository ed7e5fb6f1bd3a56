package com.fhi.model_builder.config;

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;

import com.fhi.model_builder.BuilderContext;
import com.fhi.model_builder.fake.FakeData;

import java.util.Arrays;


/**
 * Logs the effective model builder configuration during startup.
 *
 * <p>Intended to assist developers in verifying that seeds, offsets and the datasource are
 * the ones they expect when generated fixture values look surprising.
 *
 * <p>Enabled by setting:
 * <pre>
 *   model-builder.startup-diagnostics-logger.enabled=true
 * </pre>
 * in the active profile (e.g. in `application.yaml`).</p>
 */
@Slf4j
@Configuration
@ConditionalOnProperty(name = "model-builder.startup-diagnostics-logger.enabled", havingValue = "true", matchIfMissing = false)
public class StartupDiagnosticsLogger
{
   private static final String PREFIX = "[Startup Diagnostics]";

   private final Environment environment;
   private final BuilderContext builderContext;


   public StartupDiagnosticsLogger(Environment environment, BuilderContext builderContext)
   {  this.environment    = environment;
      this.builderContext = builderContext;
   }


   @PostConstruct
   public void logDebugInfo()
   {
      log.info("{} Diagnostics mode is ON", PREFIX);

      FakeData fake = builderContext.getFake();
      log.info("{} Active Spring profiles         : {}", PREFIX, Arrays.toString(environment.getActiveProfiles()));
      log.info("{} Fake data seed                 : {}", PREFIX, fake.getSeed());
      log.info("{} Identity offset                : {}", PREFIX, builderContext.getIdOffset());
      log.info("{} Vocabulary sizes               : {} first names, {} last names, {} words",
               PREFIX, fake.getVocabulary().getFirstNames().size(), fake.getVocabulary().getLastNames().size(),
               fake.getVocabulary().getWords().size());
      log.info("{} Property: spring.datasource.url = {}", PREFIX, environment.getProperty("spring.datasource.url", "NOT SET"));
   }
}
