package cafe.woden.ircingest.irc;

import cafe.woden.ircingest.config.ExecutorConfig;
import cafe.woden.ircingest.config.IngestProperties;
import cafe.woden.ircingest.logging.ChatLineSink;
import cafe.woden.ircingest.net.IrcConnector;
import io.reactivex.rxjava3.core.Completable;
import io.reactivex.rxjava3.core.Flowable;
import io.reactivex.rxjava3.core.Scheduler;
import io.reactivex.rxjava3.disposables.Disposable;
import io.reactivex.rxjava3.schedulers.Schedulers;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Runs the configured channel's ingest session, reconnecting with backoff after transport
 * failures.
 *
 * <p>Each session (connect, authenticate, receive) blocks a dedicated receive thread. Disposing the
 * subscription closes the live {@link IrcIngestor}, which ends its loop cleanly.
 */
@Service
public class IrcIngestService {
  private static final Logger log = LoggerFactory.getLogger(IrcIngestService.class);

  private final IngestProperties props;
  private final IrcConnector connector;
  private final ChatLineSink sink;
  private final Scheduler receiveScheduler;
  private final Scheduler timerScheduler;
  private final Clock clock;
  private final IngestReconnectPolicy reconnect;

  private final Object lifecycleLock = new Object();
  private Disposable running;
  private CountDownLatch terminated = new CountDownLatch(0);
  private final AtomicReference<Throwable> failure = new AtomicReference<>();

  @Autowired
  public IrcIngestService(
      IngestProperties props,
      IrcConnector connector,
      ChatLineSink sink,
      @Qualifier(ExecutorConfig.INGEST_RECEIVE_EXECUTOR) ExecutorService receiveExecutor) {
    this(props, connector, sink, Schedulers.from(receiveExecutor), Schedulers.computation(),
        Clock.systemDefaultZone());
  }

  IrcIngestService(
      IngestProperties props,
      IrcConnector connector,
      ChatLineSink sink,
      Scheduler receiveScheduler,
      Scheduler timerScheduler,
      Clock clock) {
    this.props = Objects.requireNonNull(props, "props");
    this.connector = Objects.requireNonNull(connector, "connector");
    this.sink = Objects.requireNonNull(sink, "sink");
    this.receiveScheduler = Objects.requireNonNull(receiveScheduler, "receiveScheduler");
    this.timerScheduler = Objects.requireNonNull(timerScheduler, "timerScheduler");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.reconnect = new IngestReconnectPolicy(props.client().reconnect());
  }

  /**
   * Cold: every subscription starts a fresh session. Completes when the session is closed from
   * outside; errors once reconnecting gives up.
   */
  public Completable ingest() {
    return Completable.defer(() -> {
      AtomicLong attempts = new AtomicLong();
      return session(attempts)
          .subscribeOn(receiveScheduler)
          .retryWhen(errors -> errors.flatMap(err -> {
            long attempt = attempts.incrementAndGet();
            OptionalLong delay = reconnect.nextDelayMs(err, attempt);
            if (delay.isEmpty()) {
              return Flowable.error(err);
            }
            log.warn("[ircingest] Session failed ({}); reconnect attempt {} in {}ms",
                err.getMessage(), attempt, delay.getAsLong());
            return Flowable.timer(delay.getAsLong(), TimeUnit.MILLISECONDS, timerScheduler);
          }));
    });
  }

  private Completable session(AtomicLong attempts) {
    return Completable.create(emitter -> {
      IngestProperties.Server s = props.server();
      log.info("[ircingest] Connecting to {}:{} (tls={})", s.host(), s.port(), s.tls());
      IrcIngestor ingestor = IrcIngestor.connect(connector, s.host(), s.port(), props.client(), clock);
      emitter.setCancellable(ingestor::close);

      ingestor.authenticate(s.token(), s.nick(), s.channel());

      ingestor.receiveLoop(resetAttemptsOnWelcome(attempts));
      emitter.onComplete();
    });
  }

  /**
   * Passes chunks through to the sink and clears the failure count once the server accepts the
   * login. A rejected login ends in a disconnect without a welcome, so it keeps backing off.
   */
  private ChatLineSink resetAttemptsOnWelcome(AtomicLong attempts) {
    AtomicBoolean welcomed = new AtomicBoolean();
    return (receivedAt, text) -> {
      if (!welcomed.get() && IrcIngestor.containsWelcome(text)) {
        welcomed.set(true);
        attempts.set(0);
        log.info("[ircingest] Server accepted the login");
      }
      sink.append(receivedAt, text);
    };
  }

  /** Start ingesting in the background. No-op while already running. */
  public void start() {
    synchronized (lifecycleLock) {
      if (running != null && !running.isDisposed()) return;
      CountDownLatch done = new CountDownLatch(1);
      terminated = done;
      failure.set(null);
      running = ingest()
          .doFinally(done::countDown)
          .subscribe(
              () -> log.info("[ircingest] Ingest stopped"),
              err -> {
                failure.set(err);
                log.error("[ircingest] Ingest failed: {}", err.toString(), err);
              });
    }
  }

  @PreDestroy
  public void stop() {
    Disposable d;
    synchronized (lifecycleLock) {
      d = running;
      running = null;
    }
    if (d != null && !d.isDisposed()) {
      log.info("[ircingest] Stopping ingest");
      d.dispose();
    }
  }

  /**
   * Block until the run started by {@link #start()} ends.
   *
   * @return the terminal failure, if ingestion ended with one
   */
  public Optional<Throwable> awaitTermination() throws InterruptedException {
    CountDownLatch done;
    synchronized (lifecycleLock) {
      done = terminated;
    }
    done.await();
    return Optional.ofNullable(failure.get());
  }
}
