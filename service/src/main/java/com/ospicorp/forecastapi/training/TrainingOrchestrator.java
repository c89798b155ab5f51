package com.ospicorp.forecastapi.training;

import com.ospicorp.forecastapi.forecasting.UnknownAlgorithmException;
import com.ospicorp.forecastapi.forecasting.model.AlgorithmId;
import com.ospicorp.forecastapi.forecasting.model.FittedModel;
import com.ospicorp.forecastapi.forecasting.service.ForecastContext;
import com.ospicorp.forecastapi.forecasting.service.ForecastContextFactory;
import com.ospicorp.forecastapi.forecasting.strategy.ForecastRegistry;
import com.ospicorp.forecastapi.series.model.DataSource;
import com.ospicorp.forecastapi.series.model.Observation;
import com.ospicorp.forecastapi.series.repository.DataSourceDirectory;
import com.ospicorp.forecastapi.series.repository.TimeSeriesStore;
import com.ospicorp.forecastapi.series.repository.WriteCheckpoint;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Runs training jobs on the training executor. A job trains each requested model in turn, streams
 * its fitted values into the forecast table and publishes progress at every write checkpoint.
 * The data source is marked trained only once every model has finished.
 */
@Service
public class TrainingOrchestrator {
  private static final Logger log = LoggerFactory.getLogger(TrainingOrchestrator.class);

  private final DataSourceDirectory directory;
  private final TimeSeriesStore store;
  private final ForecastContextFactory contexts;
  private final ForecastRegistry registry;
  private final Executor executor;
  private final Clock clock;
  private final Duration retention;
  private final ConcurrentMap<String, Job> jobs = new ConcurrentHashMap<>();

  @Autowired
  public TrainingOrchestrator(DataSourceDirectory directory, TimeSeriesStore store,
      ForecastContextFactory contexts, ForecastRegistry registry,
      @Qualifier("trainingExecutor") Executor executor,
      @Value("${forecasting.training.job-retention:PT24H}") Duration retention) {
    this(directory, store, contexts, registry, executor, Clock.systemUTC(), retention);
  }

  TrainingOrchestrator(DataSourceDirectory directory, TimeSeriesStore store,
      ForecastContextFactory contexts, ForecastRegistry registry, Executor executor,
      Clock clock, Duration retention) {
    if (retention.isNegative()) {
      throw new IllegalArgumentException("Job retention must not be negative: " + retention);
    }
    this.directory = directory;
    this.store = store;
    this.contexts = contexts;
    this.registry = registry;
    this.executor = executor;
    this.clock = clock;
    this.retention = retention;
  }

  /**
   * Records {@code algorithms} on the data source and schedules a job training each of them.
   *
   * @return the new job's id
   */
  public String submit(long sourceId, List<AlgorithmId> algorithms) {
    if (algorithms == null || algorithms.isEmpty()) {
      throw new IllegalArgumentException("At least one model must be requested");
    }
    List<AlgorithmId> requested = List.copyOf(new LinkedHashSet<>(algorithms));
    for (AlgorithmId algorithm : requested) {
      if (!registry.supports(algorithm)) {
        throw new UnknownAlgorithmException("No algorithm registered for " + algorithm);
      }
    }
    directory.find(sourceId)
        .orElseThrow(() -> new NoSuchElementException("No data source found with ID " + sourceId));
    directory.updateAlgorithms(sourceId, requested);

    Job job = new Job(UUID.randomUUID().toString(), sourceId, requested, clock.instant());
    jobs.put(job.id, job);
    try {
      executor.execute(() -> run(job));
    } catch (RejectedExecutionException e) {
      jobs.remove(job.id);
      throw e;
    }
    log.info("Submitted training job {} for data source {} with models {}", job.id, sourceId,
        requested);
    return job.id;
  }

  public TrainingJob status(String jobId) {
    return find(jobId).snapshot();
  }

  /**
   * Requests cooperative cancellation. The job stops at its next checkpoint; calling this on a
   * finished job has no effect.
   */
  public TrainingJob cancel(String jobId) {
    Job job = find(jobId);
    if (!job.snapshot().isTerminal() && job.token.cancel()) {
      log.info("Cancellation requested for training job {}", jobId);
    }
    return job.snapshot();
  }

  /**
   * Completes with the terminal snapshot once the job succeeds or is aborted. A failed job
   * completes exceptionally with a {@link TrainingJobException} chaining the original error.
   */
  public CompletableFuture<TrainingJob> completion(String jobId) {
    return find(jobId).completion;
  }

  public double percentComplete(String jobId) {
    return status(jobId).progress().percentComplete();
  }

  /**
   * Forgets jobs that finished longer ago than the retention. Pending and running jobs are
   * always kept.
   *
   * @return the number of jobs removed
   */
  @Scheduled(fixedDelayString = "${forecasting.training.purge-interval:PT5M}")
  public int purgeFinishedJobs() {
    Instant cutoff = clock.instant().minus(retention);
    int before = jobs.size();
    jobs.values().removeIf(job -> job.finishedBefore(cutoff));
    int removed = before - jobs.size();
    if (removed > 0) {
      log.info("Purged {} training jobs finished before {}", removed, cutoff);
    }
    return removed;
  }

  private Job find(String jobId) {
    Job job = jobId == null ? null : jobs.get(jobId);
    if (job == null) {
      throw new NoSuchElementException("No training job found with ID " + jobId);
    }
    return job;
  }

  private void run(Job job) {
    long started = System.nanoTime();
    job.start();
    try {
      DataSource source = directory.find(job.sourceId).orElseThrow(
          () -> new NoSuchElementException("No data source found with ID " + job.sourceId));
      List<Observation> series = store.getAll(job.sourceId);
      log.info("Training job {} loaded {} observations for data source {}", job.id,
          series.size(), job.sourceId);

      int totalModels = job.algorithms.size();
      for (int i = 0; i < totalModels; i++) {
        if (abortIfRequested(job)) {
          return;
        }
        AlgorithmId algorithm = job.algorithms.get(i);
        job.publish(new TrainingProgress(0, 0, i, totalModels));

        ForecastContext context = contexts.create(job.sourceId, algorithm);
        FittedModel model = context.train(series, source.frequency());
        Iterator<WriteCheckpoint> checkpoints =
            store.insertForecastBatch(model.fitted(), job.sourceId, algorithm);
        while (checkpoints.hasNext()) {
          WriteCheckpoint checkpoint = checkpoints.next();
          if (abortIfRequested(job)) {
            return;
          }
          job.publish(new TrainingProgress(checkpoint.rowsWritten(), checkpoint.totalRows(), i,
              totalModels));
          log.debug("Training job {}: {} of {} rows written for {}", job.id,
              checkpoint.rowsWritten(), checkpoint.totalRows(), algorithm.wireName());
        }
        log.info("Training job {} finished model {} ({} of {})", job.id, algorithm.wireName(),
            i + 1, totalModels);
      }

      directory.markTrained(job.sourceId);
      job.finish(TrainingJobState.SUCCEEDED, TrainingProgress.completed(totalModels), null);
      log.info("Training job {} succeeded in {} ms", job.id,
          (System.nanoTime() - started) / 1_000_000);
    } catch (RuntimeException e) {
      String cause = e.getMessage() == null ? e.getClass().getName() : e.getMessage();
      log.error("Training job {} for data source {} failed: {}", job.id, job.sourceId, cause, e);
      // reported through the job, never thrown onto the pool thread
      job.fail(cause,
          new TrainingJobException(job.id, "Training job " + job.id + " failed: " + cause, e));
    }
  }

  private boolean abortIfRequested(Job job) {
    if (!job.token.isCancellationRequested()) {
      return false;
    }
    job.finish(TrainingJobState.ABORTED, null, null);
    log.info("Training job {} aborted", job.id);
    return true;
  }

  private final class Job {
    final String id;
    final long sourceId;
    final List<AlgorithmId> algorithms;
    final Instant submittedAt;
    final CancellationToken token = new CancellationToken();
    final CompletableFuture<TrainingJob> completion = new CompletableFuture<>();

    private TrainingJobState state = TrainingJobState.PENDING;
    private TrainingProgress progress;
    private String error;
    private Instant finishedAt;

    Job(String id, long sourceId, List<AlgorithmId> algorithms, Instant submittedAt) {
      this.id = id;
      this.sourceId = sourceId;
      this.algorithms = algorithms;
      this.submittedAt = submittedAt;
      this.progress = TrainingProgress.notStarted(algorithms.size());
    }

    synchronized void start() {
      state = TrainingJobState.RUNNING;
    }

    synchronized void publish(TrainingProgress next) {
      state = TrainingJobState.PROGRESS;
      progress = next;
    }

    // progress stays where it was unless a final value is given
    void finish(TrainingJobState terminal, TrainingProgress finalProgress, String cause) {
      completion.complete(settle(terminal, finalProgress, cause));
    }

    void fail(String cause, TrainingJobException failure) {
      settle(TrainingJobState.FAILED, null, cause);
      completion.completeExceptionally(failure);
    }

    private synchronized TrainingJob settle(TrainingJobState terminal,
        TrainingProgress finalProgress, String cause) {
      state = terminal;
      if (finalProgress != null) {
        progress = finalProgress;
      }
      error = cause;
      finishedAt = clock.instant();
      return snapshot();
    }

    synchronized boolean finishedBefore(Instant cutoff) {
      return finishedAt != null && finishedAt.isBefore(cutoff);
    }

    synchronized TrainingJob snapshot() {
      return new TrainingJob(id, sourceId, algorithms, state, progress, error, submittedAt,
          finishedAt);
    }
  }
}
