package courier.test.fixture;

import courier.api.RequestHandler;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.atomic.AtomicInteger;

/** Answers every {@link Ping} with a fixed reply and counts its invocations. */
public class PingHandler implements RequestHandler<Ping, String> {

  private final String reply;
  private final AtomicInteger invocations = new AtomicInteger();

  public PingHandler() {
    this("pong!");
  }

  public PingHandler(String reply) {
    this.reply = reply;
  }

  @Override
  public CompletionStage<String> handle(Ping request) {
    invocations.incrementAndGet();
    return CompletableFuture.completedFuture(reply);
  }

  public int invocations() {
    return invocations.get();
  }
}
