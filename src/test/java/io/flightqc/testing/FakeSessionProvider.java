package io.flightqc.testing;

import io.flightqc.application.port.RemoteSession;
import io.flightqc.application.port.SessionProvider;
import io.flightqc.domain.error.ConnectionException;
import io.flightqc.domain.remote.SessionCredentials;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link SessionProvider} handing out {@link FakeRemoteSession}s. Scripted outcomes are consumed in open order;
 * once the script runs out every open yields a healthy session.
 */
public final class FakeSessionProvider implements SessionProvider {

  /** Outcome of one scripted open. */
  public enum Outcome {
    HEALTHY,
    DEAD,
    READ_RESETS,
    REFUSED
  }

  private final FakeSite site;
  private final Deque<Outcome> script = new ArrayDeque<>();
  private final List<FakeRemoteSession> opened = new ArrayList<>();
  private final AtomicInteger attempts = new AtomicInteger();

  public FakeSessionProvider(FakeSite site) {
    this.site = site;
  }

  /** Appends {@code count} copies of {@code outcome} to the script. */
  public synchronized FakeSessionProvider then(Outcome outcome, int count) {
    for (int i = 0; i < count; i++) {
      script.addLast(outcome);
    }
    return this;
  }

  @Override
  public RemoteSession open(SessionCredentials credentials, Duration connectTimeout) throws ConnectionException {
    return open(connectTimeout);
  }

  /** Opens a session without credentials; used as a pool session factory. */
  public FakeRemoteSession open(Duration connectTimeout) throws ConnectionException {
    int n = attempts.incrementAndGet();
    Outcome outcome;
    synchronized (this) {
      outcome = script.isEmpty() ? Outcome.HEALTHY : script.removeFirst();
    }
    FakeRemoteSession.Behavior behavior = switch (outcome) {
      case REFUSED -> throw new ConnectionException("Connection refused (attempt " + n + ")");
      case DEAD -> FakeRemoteSession.Behavior.DEAD;
      case READ_RESETS -> FakeRemoteSession.Behavior.READ_RESETS;
      case HEALTHY -> FakeRemoteSession.Behavior.HEALTHY;
    };
    FakeRemoteSession session = new FakeRemoteSession("fake-" + n, site, behavior);
    synchronized (this) {
      opened.add(session);
    }
    return session;
  }

  public int attempts() {
    return attempts.get();
  }

  public synchronized List<FakeRemoteSession> opened() {
    return List.copyOf(opened);
  }

  public synchronized boolean allClosed() {
    return opened.stream().allMatch(FakeRemoteSession::closed);
  }

  public synchronized boolean anyOverlapped() {
    return opened.stream().anyMatch(FakeRemoteSession::overlapped);
  }
}
