package io.llmanalytics.backpressure.loadtest;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Properties;
import java.util.concurrent.ThreadLocalRandom;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.llmanalytics.backpressure.ConfigurationException;
import io.llmanalytics.backpressure.limiter.SlidingWindowRateLimiter;
import io.llmanalytics.backpressure.loadtest.assessment.AssessmentPolicy;
import io.llmanalytics.backpressure.loadtest.assessment.AssessmentPolicy.OutcomeKind;
import io.llmanalytics.backpressure.store.BackingStoreException;
import io.llmanalytics.backpressure.store.InMemoryTimeOrderedStore;
import io.llmanalytics.backpressure.store.PooledTimeOrderedStore;
import io.llmanalytics.backpressure.store.TimeOrderedStore;

/**
 * Drives the standard load phases against a store and the rate limiter built on it:
 * <ul>
 *   <li>SET - write a member to a random key of the key space</li>
 *   <li>GET - count a random key after pre-populating the key space; a non-empty key is a hit</li>
 *   <li>MIXED - random mix of writes, counts, range deletes and TTL updates</li>
 *   <li>CONNECTIONS - hold the configured number of pool connections at once and ping each; only
 *       when the store is a {@link PooledTimeOrderedStore}</li>
 *   <li>RATE_LIMIT - limiter checks for random client ids; an admission is a positive outcome</li>
 * </ul>
 * Each report is assessed and handed to the sink, followed by the mean-throughput verdict over the
 * store phases (SET, GET and MIXED).
 *
 * <p>Usage: {@code LoadTestRunner [path/to/backpressure.properties]}. Without an argument the
 * classpath copy of backpressure.properties is used.
 */
public final class LoadTestRunner {
  private static final Logger logger = LoggerFactory.getLogger(LoadTestRunner.class);

  static final String DATA_KEY_PREFIX = "load_test:key:";
  static final String MIXED_KEY_PREFIX = "load_test:mixed:";
  static final String CLIENT_PREFIX = "client-";
  static final Duration DATA_TTL = Duration.ofSeconds(300);

  private final LoadTestConfig config;
  private final TimeOrderedStore store;
  private final SlidingWindowRateLimiter limiter;
  private final LoadHarness harness;
  private final AssessmentPolicy policy;
  private final ReportSink sink;

  public LoadTestRunner(LoadTestConfig config, TimeOrderedStore store, SlidingWindowRateLimiter limiter,
      LoadHarness harness, AssessmentPolicy policy, ReportSink sink) {
    this.config = Objects.requireNonNull(config, "config");
    this.store = Objects.requireNonNull(store, "store");
    this.limiter = Objects.requireNonNull(limiter, "limiter");
    this.harness = Objects.requireNonNull(harness, "harness");
    this.policy = Objects.requireNonNull(policy, "policy");
    this.sink = Objects.requireNonNull(sink, "sink");
  }

  /**
   * Wires an in-memory store behind a bounded pool, the limiter and the harness from config.
   */
  public static LoadTestRunner fromConfig(LoadTestConfig config, ReportSink sink) {
    TimeOrderedStore store = new PooledTimeOrderedStore(new InMemoryTimeOrderedStore(),
        config.getPoolSize(), config.getAcquireTimeout());
    SlidingWindowRateLimiter limiter = SlidingWindowRateLimiter.newBuilder(store).build();
    LoadHarness harness = LoadHarness.newBuilder()
        .setupRetryPolicy(config.getSetupRetryPolicy())
        .phaseTimeout(config.getPhaseTimeout().orElse(null))
        .build();
    return new LoadTestRunner(config, store, limiter, harness, AssessmentPolicy.defaults(), sink);
  }

  public List<LoadTestReport> run() {
    logger.info("Starting load test with {}", config);
    List<LoadTestReport> reports = new ArrayList<>();

    reports.add(phase("SET", OutcomeKind.NONE, worker -> this::set));

    int missing = populate();
    if (missing > 0)
      logger.warn("Pre-population left {} of {} keys unwritten", missing, config.getKeySpaceSize());
    reports.add(phase("GET", OutcomeKind.HIT, worker -> this::get));

    reports.add(phase("MIXED", OutcomeKind.NONE, worker -> this::mixed));
    List<LoadTestReport> storePhases = new ArrayList<>(reports);

    if (store instanceof PooledTimeOrderedStore) {
      ConnectionReport connections = new ConnectionCheck().run((PooledTimeOrderedStore) store, config.getConnections());
      sink.connections(connections, policy.classifyConcurrency(connections.getEstablished()));
    } else {
      logger.info("Skipping connection check, store is not pooled");
    }

    reports.add(phase("RATE_LIMIT", OutcomeKind.ADMIT, worker -> this::checkRateLimit));

    sink.summary(storePhases, policy.classifyMeanThroughput(storePhases));
    logger.info("Load test completed");
    return reports;
  }

  private LoadTestReport phase(String name, OutcomeKind kind, OperationFactory factory) {
    LoadTestReport report = harness.runPhase(name, config.getTotalOps(), config.getConcurrency(), factory);
    sink.accept(report, policy.assess(report, kind));
    return report;
  }

  private boolean set() throws BackingStoreException {
    ThreadLocalRandom rnd = ThreadLocalRandom.current();
    String key = DATA_KEY_PREFIX + rnd.nextInt(config.getKeySpaceSize());
    long now = System.currentTimeMillis();
    return store.atomically(key, s -> {
      s.addTimedMember(key, now, "value_" + rnd.nextInt(1_000_000));
      s.setTtl(key, DATA_TTL);
      return true;
    });
  }

  private boolean get() throws BackingStoreException {
    String key = DATA_KEY_PREFIX + ThreadLocalRandom.current().nextInt(config.getKeySpaceSize());
    return store.countMembers(key) > 0;
  }

  private boolean mixed() throws BackingStoreException {
    ThreadLocalRandom rnd = ThreadLocalRandom.current();
    String key = MIXED_KEY_PREFIX + rnd.nextInt(config.getKeySpaceSize());
    long now = System.currentTimeMillis();
    switch (rnd.nextInt(4)) {
      case 0:
        store.addTimedMember(key, now, "item_" + rnd.nextLong());
        break;
      case 1:
        store.countMembers(key);
        break;
      case 2:
        store.removeMembersBelow(key, now - DATA_TTL.toMillis());
        break;
      default:
        store.setTtl(key, DATA_TTL);
    }
    return true;
  }

  private boolean checkRateLimit() {
    String client = CLIENT_PREFIX + ThreadLocalRandom.current().nextInt(config.getKeySpaceSize());
    return limiter.check(client, config.getLimit(), config.getWindow()).isAllowed();
  }

  /**
   * Writes one member to every key of the key space. Returns how many keys could not be written.
   */
  private int populate() {
    logger.info("Pre-populating {} keys", config.getKeySpaceSize());
    long now = System.currentTimeMillis();
    int failed = 0;
    for (int i = 0; i < config.getKeySpaceSize(); i++) {
      String key = DATA_KEY_PREFIX + i;
      try {
        store.addTimedMember(key, now, "value_" + i);
        store.setTtl(key, DATA_TTL.multipliedBy(2));
      } catch (BackingStoreException e) {
        failed++;
        logger.debug("Could not pre-populate {}", key, e);
      }
    }
    return failed;
  }

  static Properties loadProperties(String[] args) throws IOException {
    Properties props = new Properties();
    try (InputStream in = LoadTestRunner.class.getClassLoader().getResourceAsStream("backpressure.properties")) {
      if (in != null)
        props.load(in);
    }
    if (args.length > 0) {
      Path path = Paths.get(args[0]);
      try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
        props.load(reader);
      }
    }
    return props;
  }

  public static void main(String[] args) {
    LoadTestConfig config;
    try {
      config = LoadTestConfig.fromProperties(loadProperties(args));
    } catch (ConfigurationException | IOException e) {
      logger.error("Invalid configuration: {}", e.getMessage());
      System.exit(1);
      return;
    }
    fromConfig(config, new LoggingReportSink()).run();
  }
}
