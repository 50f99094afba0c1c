/*
 * Where: heuleum worker
 * What: Pulls deliveries from the broker and dispatches them to a bounded worker pool
 * Why: In-flight work is capped and every message is settled exactly once, including on shutdown
 */
package com.example.heuleum.worker;

import com.example.heuleum.config.SubscriberLoopProperties;
import com.example.heuleum.model.Disposition;
import com.example.heuleum.model.LoopState;
import com.example.heuleum.service.BrokerException;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class SubscriberLoop {

  private static final Logger logger = LoggerFactory.getLogger(SubscriberLoop.class);
  private static final double JITTER_MIN = 0.5d;
  private static final double JITTER_MAX = 1.5d;

  private final MessageSource source;
  private final SubscriberContext context;
  private final SubscriberLoopProperties properties;
  private final MessageDispatcher dispatcher;
  private final Semaphore permits;
  private final Set<InFlightMessage> inFlight = ConcurrentHashMap.newKeySet();
  private final AtomicBoolean running = new AtomicBoolean(false);
  private final ExecutorService workers;
  private volatile LoopState state = LoopState.IDLE;
  private Thread loopThread;

  public SubscriberLoop(MessageSource source, SubscriberContext context) {
    this.source = source;
    this.context = context;
    this.properties = context.loop();
    this.dispatcher = new MessageDispatcher(context);
    this.permits = new Semaphore(properties.maxInFlight());
    this.workers =
        Executors.newFixedThreadPool(
            properties.workerThreads(),
            new ThreadFactoryBuilder().setNameFormat("heuleum-worker-%d").build());
  }

  @PostConstruct
  public void start() {
    if (!running.compareAndSet(false, true)) {
      return;
    }
    loopThread =
        new ThreadFactoryBuilder().setNameFormat("heuleum-subscriber").build().newThread(this::run);
    loopThread.start();
    logger.info(
        "subscriber loop started maxInFlight={} workerThreads={} maxAttempts={}",
        properties.maxInFlight(),
        properties.workerThreads(),
        context.maxAttempts());
  }

  @PreDestroy
  public void stop() {
    if (!running.compareAndSet(true, false)) {
      return;
    }
    state = LoopState.DRAINING;
    logger.info("subscriber loop draining inFlight={}", inFlight.size());
    joinLoopThread();
    workers.shutdown();
    try {
      if (!workers.awaitTermination(properties.shutdownGrace().toMillis(), TimeUnit.MILLISECONDS)) {
        logger.warn("shutdown grace elapsed with unsettled messages inFlight={}", inFlight.size());
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
    }
    final int forced = forceNackUnsettled();
    workers.shutdownNow();
    source.close();
    state = LoopState.STOPPED;
    logger.info("subscriber loop stopped forceNacked={}", forced);
  }

  public LoopState state() {
    return state;
  }

  public int inFlightCount() {
    return inFlight.size();
  }

  public long trackedMessageCount() {
    return context.tracker().size();
  }

  private void run() {
    int consecutiveFailures = 0;
    while (running.get()) {
      transition(LoopState.IDLE);
      final int acquired;
      try {
        acquired = acquirePermits();
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        break;
      }
      if (acquired == 0) {
        continue;
      }
      transition(LoopState.PULLING);
      final List<InboundMessage> batch;
      try {
        batch = source.pull(acquired, properties.fetchWait());
        consecutiveFailures = 0;
      } catch (BrokerException ex) {
        permits.release(acquired);
        consecutiveFailures++;
        context.metrics().recordBrokerError();
        final Duration backoff = backoffDelay(consecutiveFailures);
        logger.warn(
            "broker pull failed failures={} backoffMs={}", consecutiveFailures, backoff.toMillis(), ex);
        if (!sleep(backoff)) {
          break;
        }
        source.reset();
        continue;
      }
      permits.release(acquired - batch.size());
      if (!running.get()) {
        // shutdown was requested while the pull was blocked
        nackUndispatched(batch);
        break;
      }
      if (!batch.isEmpty()) {
        transition(LoopState.DISPATCHING);
        batch.forEach(this::submit);
      }
    }
    logger.debug("subscriber pull thread exited");
  }

  // DRAINING and STOPPED belong to the shutdown path
  private void transition(LoopState next) {
    if (running.get()) {
      state = next;
    }
  }

  // waits for the first free slot, then takes whatever else is free up to the batch size
  private int acquirePermits() throws InterruptedException {
    if (!permits.tryAcquire(properties.fetchWait().toMillis(), TimeUnit.MILLISECONDS)) {
      return 0;
    }
    int acquired = 1;
    while (acquired < properties.fetchBatchSize() && permits.tryAcquire()) {
      acquired++;
    }
    return acquired;
  }

  private void submit(InboundMessage delivery) {
    final InFlightMessage message = new InFlightMessage(delivery, context.metrics());
    inFlight.add(message);
    context.metrics().updateInFlight(inFlight.size());
    try {
      workers.execute(() -> process(message));
    } catch (RejectedExecutionException ex) {
      logger.warn("worker pool rejected message messageId={}", message.raw().messageId());
      release(message);
      if (message.nack()) {
        context.metrics().recordOutcome(Disposition.NACKED.metricValue());
      }
    }
  }

  private void process(InFlightMessage message) {
    try {
      dispatcher.dispatch(message);
    } catch (RuntimeException ex) {
      logger.error("dispatch failed messageId={}", message.raw().messageId(), ex);
      if (message.nack()) {
        context.metrics().recordOutcome(Disposition.NACKED.metricValue());
      }
    } finally {
      release(message);
    }
  }

  private void release(InFlightMessage message) {
    if (inFlight.remove(message)) {
      permits.release();
    }
    context.metrics().updateInFlight(inFlight.size());
  }

  private void nackUndispatched(List<InboundMessage> batch) {
    for (InboundMessage delivery : batch) {
      final InFlightMessage message = new InFlightMessage(delivery, context.metrics());
      if (message.nack()) {
        context.metrics().recordOutcome(Disposition.FORCE_NACKED.metricValue());
      }
      permits.release();
    }
  }

  private int forceNackUnsettled() {
    int forced = 0;
    for (InFlightMessage message : inFlight) {
      if (message.nack()) {
        forced++;
        context.metrics().recordOutcome(Disposition.FORCE_NACKED.metricValue());
        logger.warn("message force-nacked on shutdown messageId={}", message.raw().messageId());
      }
    }
    return forced;
  }

  private void joinLoopThread() {
    if (loopThread == null) {
      return;
    }
    try {
      // a blocked pull returns within fetch-wait
      loopThread.join(properties.fetchWait().toMillis() + properties.shutdownGrace().toMillis());
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
    }
    if (loopThread.isAlive()) {
      loopThread.interrupt();
    }
  }

  private boolean sleep(Duration duration) {
    try {
      Thread.sleep(duration.toMillis());
      return true;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      return false;
    }
  }

  @VisibleForTesting
  Duration backoffDelay(int failures) {
    final double baseMillis = properties.reconnectBackoffBase().toMillis();
    final double exp = baseMillis * Math.pow(2.0d, Math.min(failures - 1, 30));
    final double jitter = JITTER_MIN + ThreadLocalRandom.current().nextDouble() * (JITTER_MAX - JITTER_MIN);
    final long millis = (long) Math.ceil(exp * jitter);
    return Duration.ofMillis(Math.min(millis, properties.reconnectBackoffMax().toMillis()));
  }
}
