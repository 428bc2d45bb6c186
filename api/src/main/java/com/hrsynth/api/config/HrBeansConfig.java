package com.hrsynth.api.config;

import com.hrsynth.api.client.ReferenceDataLoader;
import com.hrsynth.api.model.ReferenceCatalog;
import io.github.resilience4j.bulkhead.Bulkhead;
import io.github.resilience4j.bulkhead.BulkheadConfig;
import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springdoc.core.models.GroupedOpenApi;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(HrGeneratorProperties.class)
public class HrBeansConfig {

  private static final Logger log = LoggerFactory.getLogger(HrBeansConfig.class);

  @Bean
  public ReferenceDataLoader referenceDataLoader(
      @Value("${hr.reference.base-path:" + ReferenceDataLoader.DEFAULT_BASE_PATH + "}")
          String basePath) {
    return new ReferenceDataLoader(basePath, HrBeansConfig.class.getClassLoader());
  }

  @Bean
  public ReferenceCatalog referenceCatalog(ReferenceDataLoader loader) throws IOException {
    return loader.loadCatalog();
  }

  @Bean(destroyMethod = "shutdown")
  public ExecutorService generationExecutor(HrGeneratorProperties properties) {
    int threads = properties.effectiveParallelism();
    AtomicInteger counter = new AtomicInteger();
    ThreadFactory factory =
        runnable -> {
          Thread thread = new Thread(runnable, "hr-generator-" + counter.incrementAndGet());
          thread.setDaemon(true);
          return thread;
        };
    log.info("Employee generation pool sized to {} thread(s)", threads);
    return Executors.newFixedThreadPool(threads, factory);
  }

  @Bean
  public Bulkhead generationBulkhead(
      HrGeneratorProperties properties,
      @Value("${hr.bulkhead.max-wait:PT0S}") Duration maxWait) {
    BulkheadConfig config =
        BulkheadConfig.custom()
            .maxConcurrentCalls(properties.maxConcurrentRuns())
            .maxWaitDuration(maxWait)
            .build();
    return Bulkhead.of("hrGeneration", config);
  }

  @Bean
  public GroupedOpenApi publicApi() {
    return GroupedOpenApi.builder().group("public").pathsToMatch("/api/**").build();
  }
}
