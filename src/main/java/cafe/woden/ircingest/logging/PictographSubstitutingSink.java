package cafe.woden.ircingest.logging;

import java.io.Closeable;
import java.io.IOException;
import java.time.LocalDateTime;
import java.util.Objects;
import java.util.function.UnaryOperator;

/** Decorates another sink, rewriting the text before it reaches the delegate. */
public final class PictographSubstitutingSink implements ChatLineSink, Closeable {

  private final ChatLineSink delegate;
  private final UnaryOperator<String> substitution;

  public PictographSubstitutingSink(ChatLineSink delegate) {
    this(delegate, new PictographTextSubstitution());
  }

  PictographSubstitutingSink(ChatLineSink delegate, UnaryOperator<String> substitution) {
    this.delegate = Objects.requireNonNull(delegate, "delegate");
    this.substitution = Objects.requireNonNull(substitution, "substitution");
  }

  @Override
  public void append(LocalDateTime receivedAt, String text) {
    delegate.append(receivedAt, substitution.apply(text));
  }

  @Override
  public void close() throws IOException {
    if (delegate instanceof Closeable c) c.close();
  }
}
