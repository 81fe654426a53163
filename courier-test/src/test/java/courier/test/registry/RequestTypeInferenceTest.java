package courier.test.registry;

import courier.api.BlockingRequestHandler;
import courier.api.Request;
import courier.api.RequestHandler;
import courier.core.DefaultMediator;
import courier.test.BaseTest;
import courier.test.fixture.Echo;
import courier.test.fixture.Ping;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class RequestTypeInferenceTest extends BaseTest {

  @DisplayName("INFER-TC-001: the request type is inferred through an abstract base handler")
  @Test
  public void testInferenceThroughSuperclass() throws Exception {
    DefaultMediator mediator = newMediator();
    mediator.registerHandler(new UpperCaseEchoHandler());

    assertThat(await(mediator.send(new Echo("hi"))).value()).isEqualTo("HI");
  }

  @DisplayName("INFER-TC-002: the request type is inferred for anonymous handler classes")
  @Test
  public void testInferenceForAnonymousClass() throws Exception {
    DefaultMediator mediator = newMediator();
    mediator.registerHandler(
        new RequestHandler<Ping, String>() {
          @Override
          public CompletionStage<String> handle(Ping request) {
            return CompletableFuture.completedFuture("anonymous pong");
          }
        });

    assertThat(await(mediator.send(new Ping())).value()).isEqualTo("anonymous pong");
  }

  @DisplayName("INFER-TC-003: lambdas need an explicit request class")
  @Test
  public void testLambdaIsRejected() {
    DefaultMediator mediator = newMediator();
    RequestHandler<Ping, String> lambda = request -> CompletableFuture.completedFuture("x");
    BlockingRequestHandler<Ping, String> blockingLambda = request -> "x";

    assertThatThrownBy(() -> mediator.registerHandler(lambda))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("explicit request class");
    assertThatThrownBy(() -> mediator.registerBlockingHandler(blockingLambda))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @DisplayName("INFER-TC-004: a handler still generic in its request type is rejected")
  @Test
  public void testUnboundTypeVariableIsRejected() {
    DefaultMediator mediator = newMediator();

    assertThatThrownBy(() -> mediator.registerHandler(new ConstantHandler<Ping>()))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @DisplayName("INFER-TC-005: interface request types can never match a request and are rejected")
  @Test
  public void testAbstractRequestTypeIsRejected() {
    DefaultMediator mediator = newMediator();

    assertThatThrownBy(
            () ->
                mediator.registerHandler(
                    Shape.class, request -> CompletableFuture.completedFuture(1.0)))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("concrete");
    assertThatThrownBy(() -> mediator.registerHandler(new ShapeHandler()))
        .isInstanceOf(IllegalArgumentException.class);
  }

  interface Shape extends Request<Double> {}

  abstract static class TransformingEchoHandler<Q extends Request<String>>
      implements RequestHandler<Q, String> {

    protected abstract String transform(Q request);

    @Override
    public CompletionStage<String> handle(Q request) {
      return CompletableFuture.completedFuture(transform(request));
    }
  }

  static class UpperCaseEchoHandler extends TransformingEchoHandler<Echo> {
    @Override
    protected String transform(Echo request) {
      return request.x().toUpperCase();
    }
  }

  static class ConstantHandler<Q extends Request<String>> implements RequestHandler<Q, String> {
    @Override
    public CompletionStage<String> handle(Q request) {
      return CompletableFuture.completedFuture("constant");
    }
  }

  static class ShapeHandler implements RequestHandler<Shape, Double> {
    @Override
    public CompletionStage<Double> handle(Shape request) {
      return CompletableFuture.completedFuture(0.0);
    }
  }
}
