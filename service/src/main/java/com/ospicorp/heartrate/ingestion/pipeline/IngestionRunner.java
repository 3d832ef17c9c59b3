package com.ospicorp.heartrate.ingestion.pipeline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/** Runs a single ingestion when {@code ingestion.enabled=true} and reports its outcome as the exit code. */
@Component
@ConditionalOnProperty(name = "ingestion.enabled", havingValue = "true")
public class IngestionRunner implements CommandLineRunner, ExitCodeGenerator {

  private static final Logger log = LoggerFactory.getLogger(IngestionRunner.class);

  private final PipelineOrchestrator orchestrator;
  private final IngestionSettings settings;
  private volatile int exitCode = RunOutcome.FAILED.exitCode();

  public IngestionRunner(PipelineOrchestrator orchestrator, IngestionSettings settings) {
    this.orchestrator = orchestrator;
    this.settings = settings;
  }

  @Override
  public void run(String... args) {
    log.info("Ingestion configuration: entity={}, batchSize={}, startDate={}, endDate={}, deltaMode={}, upsertMode={}, dataSeed={}, perturbation={}",
        settings.entityId(), settings.batchSize(), settings.startDate(), settings.endDate(),
        settings.deltaMode(), settings.upsertMode(), settings.dataSeed(), settings.intradayPerturbation());
    PipelineRun run = orchestrator.run();
    RunOutcome outcome = run.outcome();
    exitCode = outcome.exitCode();
    switch (outcome) {
      case LOADED -> log.info("Ingestion finished: {} records loaded for {}", run.recordsLoaded(), run.range());
      case NO_NEW_DATA -> log.info("Ingestion finished: no new data for {}", run.range());
      case FAILED -> log.error("Ingestion failed in state {}", run.state());
    }
  }

  @Override
  public int getExitCode() {
    return exitCode;
  }
}
