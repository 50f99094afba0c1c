package com.example.heuleum.worker;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.heuleum.model.LoopState;
import com.example.heuleum.model.SinkWriteOutcome;
import com.example.heuleum.service.BrokerException;
import com.example.heuleum.service.DeadLetterPublisher;
import com.example.heuleum.service.EventSink;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class SubscriberLoopTest {

  private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
  private final DeadLetterPublisher publisher = (subject, headers, payload, dedupeId) -> {};
  private SubscriberLoop loop;

  @AfterEach
  void tearDown() {
    if (loop != null) {
      loop.stop();
    }
  }

  @Test
  void processesBatchAndAcksEveryMessage() throws InterruptedException {
    final List<FakeInboundMessage> batch = batch(10);
    final ScriptedSource source = new ScriptedSource();
    source.batches.add(new ArrayList<>(batch));
    final EventSink sink = event -> SinkWriteOutcome.WRITTEN;
    loop = newLoop(source, sink, 16, 4, Duration.ofSeconds(2));

    loop.start();

    for (FakeInboundMessage message : batch) {
      assertThat(message.settledLatch().await(5, TimeUnit.SECONDS)).isTrue();
    }
    assertThat(batch).allSatisfy(message -> assertThat(message.acks()).isEqualTo(1));
    assertThat(batch).allSatisfy(message -> assertThat(message.nacks()).isZero());
  }

  @Test
  void shutdownDuringBatchNacksEveryUnfinishedMessage() throws InterruptedException {
    final List<FakeInboundMessage> batch = batch(10);
    final ScriptedSource source = new ScriptedSource();
    source.batches.add(new ArrayList<>(batch));
    final CountDownLatch release = new CountDownLatch(1);
    final CountDownLatch started = new CountDownLatch(4);
    final EventSink blockingSink =
        event -> {
          started.countDown();
          try {
            release.await();
          } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("interrupted while writing", ex);
          }
          return SinkWriteOutcome.WRITTEN;
        };
    loop = newLoop(source, blockingSink, 16, 4, Duration.ofMillis(100));
    loop.start();
    assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();
    awaitInFlight(10);

    loop.stop();

    assertThat(loop.state()).isEqualTo(LoopState.STOPPED);
    assertThat(batch).allSatisfy(message -> assertThat(message.acks()).isZero());
    assertThat(batch).allSatisfy(message -> assertThat(message.nacks()).isEqualTo(1));
    assertThat(source.closed).isTrue();
    assertThat(
            registry.get("heuleum.messages.total").tag("outcome", "force_nacked").counter().count())
        .isEqualTo(10.0d);
  }

  @Test
  void workerFinishingAfterForceNackDoesNotAck() throws InterruptedException {
    final List<FakeInboundMessage> batch = batch(1);
    final ScriptedSource source = new ScriptedSource();
    source.batches.add(new ArrayList<>(batch));
    final CountDownLatch started = new CountDownLatch(1);
    final EventSink slowSink =
        event -> {
          started.countDown();
          // ignores interruption so it completes after the force-nack
          final long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(300);
          while (System.nanoTime() < deadline) {
            Thread.onSpinWait();
          }
          return SinkWriteOutcome.WRITTEN;
        };
    loop = newLoop(source, slowSink, 4, 1, Duration.ofMillis(50));
    loop.start();
    assertThat(started.await(5, TimeUnit.SECONDS)).isTrue();

    loop.stop();
    Thread.sleep(500);

    assertThat(batch.get(0).nacks()).isEqualTo(1);
    assertThat(batch.get(0).acks()).isZero();
  }

  @Test
  void pullSizeNeverExceedsFreeInFlightPermits() throws InterruptedException {
    final ScriptedSource source = new ScriptedSource();
    source.batches.add(new ArrayList<>(batch(3)));
    final CountDownLatch release = new CountDownLatch(1);
    final EventSink blockingSink =
        event -> {
          try {
            release.await();
          } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(ex);
          }
          return SinkWriteOutcome.WRITTEN;
        };
    loop = newLoop(source, blockingSink, 3, 3, Duration.ofMillis(100));
    loop.start();

    awaitInFlight(3);
    Thread.sleep(100);
    // the window is full, so no further pull happens
    final int pullsWhileFull = source.pulls.get();
    Thread.sleep(200);
    assertThat(source.pulls.get()).isEqualTo(pullsWhileFull);
    assertThat(source.requested).allSatisfy(size -> assertThat(size).isLessThanOrEqualTo(3));
    release.countDown();
  }

  @Test
  void brokerFailuresAreCountedAndSourceIsReset() throws InterruptedException {
    final ScriptedSource source = new ScriptedSource();
    source.failuresRemaining.set(3);
    final List<FakeInboundMessage> batch = batch(1);
    source.batches.add(new ArrayList<>(batch));
    loop = newLoop(source, event -> SinkWriteOutcome.WRITTEN, 4, 1, Duration.ofSeconds(1));

    loop.start();

    assertThat(batch.get(0).settledLatch().await(5, TimeUnit.SECONDS)).isTrue();
    assertThat(batch.get(0).acks()).isEqualTo(1);
    assertThat(source.resets.get()).isEqualTo(3);
    assertThat(registry.get("heuleum.broker.error.total").counter().count()).isEqualTo(3.0d);
  }

  @Test
  void backoffGrowsAndStaysWithinMax() {
    loop = newLoop(new ScriptedSource(), event -> SinkWriteOutcome.WRITTEN, 4, 1, Duration.ofSeconds(1));

    assertThat(loop.backoffDelay(1)).isBetween(Duration.ofMillis(5), Duration.ofMillis(15));
    assertThat(loop.backoffDelay(20)).isLessThanOrEqualTo(Duration.ofMillis(40));
  }

  @Test
  void stopWithoutStartIsNoop() {
    loop = newLoop(new ScriptedSource(), event -> SinkWriteOutcome.WRITTEN, 4, 1, Duration.ofSeconds(1));

    loop.stop();

    assertThat(loop.state()).isEqualTo(LoopState.IDLE);
  }

  private void awaitInFlight(int expected) throws InterruptedException {
    final long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
    while (loop.inFlightCount() < expected && System.nanoTime() < deadline) {
      Thread.sleep(10);
    }
    assertThat(loop.inFlightCount()).isEqualTo(expected);
  }

  private SubscriberLoop newLoop(
      MessageSource source, EventSink sink, int maxInFlight, int workers, Duration grace) {
    final SubscriberContext context =
        SubscriberFixtures.context(
            sink, publisher, registry, 5, SubscriberFixtures.loopProperties(maxInFlight, workers, grace));
    return new SubscriberLoop(source, context);
  }

  private static List<FakeInboundMessage> batch(int size) {
    final List<FakeInboundMessage> messages = new ArrayList<>();
    for (int i = 0; i < size; i++) {
      messages.add(FakeInboundMessage.of("events:" + i, "{\"event\":\"x\"}", 1));
    }
    return messages;
  }

  private static final class ScriptedSource implements MessageSource {

    private final Queue<List<FakeInboundMessage>> batches = new ConcurrentLinkedQueue<>();
    private final Queue<Integer> requested = new ConcurrentLinkedQueue<>();
    private final AtomicInteger failuresRemaining = new AtomicInteger();
    private final AtomicInteger resets = new AtomicInteger();
    private final AtomicInteger pulls = new AtomicInteger();
    private volatile boolean closed;

    @Override
    public List<InboundMessage> pull(int maxMessages, Duration maxWait) {
      pulls.incrementAndGet();
      requested.add(maxMessages);
      if (failuresRemaining.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
        throw new BrokerException("connection closed", null);
      }
      final List<FakeInboundMessage> next = batches.peek();
      if (next == null) {
        sleep(maxWait);
        return List.of();
      }
      final List<InboundMessage> taken = new ArrayList<>();
      while (!next.isEmpty() && taken.size() < maxMessages) {
        taken.add(next.remove(0));
      }
      if (next.isEmpty()) {
        batches.poll();
      }
      return taken;
    }

    @Override
    public void reset() {
      resets.incrementAndGet();
    }

    @Override
    public void close() {
      closed = true;
    }

    private static void sleep(Duration duration) {
      try {
        Thread.sleep(duration.toMillis());
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
      }
    }
  }
}
