/*
 * Where: proximity discovery unit tests
 * What: verifies the listener task, its channel and cancellation
 * Why: a bad frame must never end discovery and closing must leave no running listener
 */
package com.tickety.proximity.discovery;

import static org.assertj.core.api.Assertions.assertThat;

import com.tickety.proximity.PayloadKind;
import com.tickety.proximity.ProximityFormat;
import com.tickety.proximity.ProximityPayload;
import com.tickety.proximity.ProximityPayloadCodec;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ProximityDiscoveryTest {

  private static final Duration WAIT = Duration.ofSeconds(2);

  private final ProximityPayloadCodec codec = new ProximityPayloadCodec();
  private FakeTransport transport;
  private ExecutorService executor;
  private ProximityDiscovery discovery;

  @BeforeEach
  void setUp() {
    transport = new FakeTransport(true);
    executor = Executors.newSingleThreadExecutor();
    discovery = new ProximityDiscovery(transport, codec, executor, Duration.ofMillis(20), 4);
  }

  @AfterEach
  void tearDown() {
    discovery.close();
  }

  @Test
  void deliversPayloadAfterMalformedFrames() throws Exception {
    final DiscoverySession session = discovery.open(PayloadKind.CUSTOMER_IDENTITY).orElseThrow();
    transport.inbound.add(new byte[] {0x01, (byte) 0xFF});
    transport.inbound.add("TICKETY_UNKNOWN:x".getBytes(StandardCharsets.UTF_8));
    transport.inbound.add(
        codec.encode(ProximityPayload.customerIdentity("user-1"), ProximityFormat.TAGGED_TEXT));

    final Optional<ProximityPayload> payload = session.next(WAIT);

    assertThat(payload).contains(ProximityPayload.customerIdentity("user-1"));
    assertThat(session.malformedFrames()).isEqualTo(2);
    session.close();
  }

  @Test
  void transportFaultDoesNotEndDiscovery() throws Exception {
    transport.failuresLeft.set(1);
    transport.inbound.add(
        codec.encode(ProximityPayload.customerIdentity("actor-c"), ProximityFormat.TAGGED_TEXT));
    final DiscoverySession session = discovery.open(PayloadKind.CUSTOMER_IDENTITY).orElseThrow();

    final Optional<ProximityPayload> payload = session.next(WAIT);

    assertThat(payload).contains(ProximityPayload.customerIdentity("actor-c"));
    assertThat(session.transportFaults()).isEqualTo(1);
    assertThat(session.isClosed()).isFalse();
    session.close();
  }

  @Test
  void repeatedTransportFaultsCloseTheSession() throws Exception {
    transport.failuresLeft.set(Integer.MAX_VALUE);
    final DiscoverySession session = discovery.open(PayloadKind.CUSTOMER_IDENTITY).orElseThrow();

    final long deadline = System.nanoTime() + WAIT.toNanos();
    while (!session.isClosed() && System.nanoTime() < deadline) {
      Thread.sleep(5);
    }

    assertThat(session.isClosed()).isTrue();
    assertThat(session.transportFaults()).isEqualTo(DiscoverySession.MAX_CONSECUTIVE_FAULTS);
    assertThat(session.next(Duration.ofMillis(10))).isEmpty();
  }

  @Test
  void ignoresPayloadsOfOtherKind() throws Exception {
    final DiscoverySession session = discovery.open(PayloadKind.TICKET_CLAIM).orElseThrow();
    transport.inbound.add(
        codec.encode(ProximityPayload.customerIdentity("user-1"), ProximityFormat.TAGGED_TEXT));
    transport.inbound.add(
        codec.encode(ProximityPayload.ticketClaim("token-1", null), ProximityFormat.URI));

    assertThat(session.next(WAIT)).contains(ProximityPayload.ticketClaim("token-1", null));
    session.close();
  }

  @Test
  void unavailableTransportAsksForFallback() {
    final ProximityDiscovery offline =
        new ProximityDiscovery(new FakeTransport(false), codec, executor, Duration.ofMillis(20), 4);

    assertThat(offline.open(PayloadKind.CUSTOMER_IDENTITY)).isEmpty();
  }

  @Test
  void closeStopsTheListenerTaskAndIsIdempotent() throws Exception {
    final DiscoverySession session = discovery.open(PayloadKind.CUSTOMER_IDENTITY).orElseThrow();
    assertThat(transport.reading.await(WAIT.toMillis(), TimeUnit.MILLISECONDS)).isTrue();

    session.close();
    session.close();

    assertThat(session.isClosed()).isTrue();
    assertThat(session.next(Duration.ofMillis(10))).isEmpty();
    // The single worker thread is free again only if the read loop has exited.
    assertThat(executor.submit(() -> true).get(WAIT.toMillis(), TimeUnit.MILLISECONDS)).isTrue();
  }

  @Test
  void broadcasterEncodesAndStops() {
    final ProximityBroadcaster broadcaster = new ProximityBroadcaster(transport, codec);

    assertThat(broadcaster.start(ProximityPayload.customerIdentity("user-2"), ProximityFormat.RAW_TEXT))
        .isTrue();
    assertThat(new String(transport.broadcasting, StandardCharsets.UTF_8)).isEqualTo("user-2");

    broadcaster.stop();
    broadcaster.stop();

    assertThat(transport.broadcasting).isNull();
    assertThat(transport.stopCalls).isEqualTo(1);
  }

  private static final class FakeTransport implements ProximityTransport {

    private final boolean available;
    private final BlockingQueue<byte[]> inbound = new LinkedBlockingQueue<>();
    private final CountDownLatch reading = new CountDownLatch(1);
    private final AtomicInteger failuresLeft = new AtomicInteger();
    private volatile byte[] broadcasting;
    private volatile int stopCalls;

    private FakeTransport(boolean available) {
      this.available = available;
    }

    @Override
    public boolean isAvailable() {
      return available;
    }

    @Override
    public void broadcast(byte[] frame) {
      broadcasting = frame;
    }

    @Override
    public void stopBroadcast() {
      broadcasting = null;
      stopCalls++;
    }

    @Override
    public byte[] receive(Duration timeout) throws InterruptedException {
      reading.countDown();
      if (failuresLeft.getAndDecrement() > 0) {
        throw new IllegalStateException("radio read failed");
      }
      return inbound.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }
  }
}
