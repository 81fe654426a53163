package courier.test.blocking;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import courier.api.HandlerExecutionException;
import courier.api.Result;
import courier.core.DefaultMediator;
import courier.test.BaseTest;
import courier.test.fixture.Add;
import courier.test.fixture.AddHandler;
import courier.test.fixture.Ping;
import courier.test.fixture.PingHandler;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;

import static org.assertj.core.api.Assertions.assertThat;

public class ExecutorOwnershipTest extends BaseTest {

  @DisplayName("LIFECYCLE-TC-001: blocking handlers use a caller-supplied executor")
  @Test
  public void testSuppliedExecutorIsUsed() throws Exception {
    ExecutorService executor =
        Executors.newSingleThreadExecutor(
            new ThreadFactoryBuilder().setNameFormat("custom-worker-%d").build());
    try {
      DefaultMediator mediator =
          track(DefaultMediator.builder().blockingExecutor(executor).build());
      AddHandler handler = new AddHandler();
      mediator.registerBlockingHandler(handler);

      assertThat(await(mediator.send(new Add(1, 1))).value()).isEqualTo(2);
      assertThat(handler.lastThreadName()).isEqualTo("custom-worker-0");
    } finally {
      executor.shutdownNow();
    }
  }

  @DisplayName("LIFECYCLE-TC-002: closing the mediator leaves a caller-supplied executor running")
  @Test
  public void testSuppliedExecutorIsNotShutDown() {
    ExecutorService executor = Executors.newSingleThreadExecutor();
    try {
      DefaultMediator mediator = DefaultMediator.builder().blockingExecutor(executor).build();
      mediator.close();

      assertThat(executor.isShutdown()).isFalse();
    } finally {
      executor.shutdownNow();
    }
  }

  @DisplayName("LIFECYCLE-TC-003: after close, blocking sends fail and asynchronous sends still work")
  @Test
  public void testSendAfterClose() throws Exception {
    DefaultMediator mediator = newMediator();
    mediator.registerBlockingHandler(new AddHandler());
    mediator.registerHandler(new PingHandler());
    mediator.close();

    Result<Integer> blocking = await(mediator.send(new Add(1, 2)));
    Result<String> async = await(mediator.send(new Ping()));

    assertThat(blocking.cause()).isInstanceOf(HandlerExecutionException.class);
    assertThat(blocking.cause().getCause()).isInstanceOf(RejectedExecutionException.class);
    assertThat(async.value()).isEqualTo("pong!");
  }
}
