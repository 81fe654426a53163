package courier.test.result;

import courier.api.Result;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ResultTest {

  @DisplayName("RESULT-TC-001: map transforms a success")
  @Test
  public void testMapSuccess() throws Throwable {
    Result<String> result = new Result.Success<>("pong!");

    Result<Integer> mapped = result.map(String::length);

    assertThat(mapped.isSuccess()).isTrue();
    assertThat(mapped.getOrThrow()).isEqualTo(5);
  }

  @DisplayName("RESULT-TC-002: map keeps a failure and never calls the mapper")
  @Test
  public void testMapFailure() {
    IllegalStateException cause = new IllegalStateException("nope");
    Result<String> result = new Result.Failure<>(cause);

    Result<Integer> mapped =
        result.map(
            value -> {
              throw new AssertionError("mapper must not run");
            });

    assertThat(mapped.isFailure()).isTrue();
    assertThat(mapped.cause()).isSameAs(cause);
    assertThatThrownBy(mapped::getOrThrow).isSameAs(cause);
  }

  @DisplayName("RESULT-TC-003: a failure requires a cause")
  @Test
  public void testFailureRequiresCause() {
    assertThatThrownBy(() -> new Result.Failure<String>(null))
        .isInstanceOf(NullPointerException.class);
  }

  @DisplayName("RESULT-TC-004: a success may hold null")
  @Test
  public void testNullSuccess() {
    Result<Void> result = new Result.Success<>(null);

    assertThat(result.isSuccess()).isTrue();
    assertThat(result.value()).isNull();
    assertThat(result.cause()).isNull();
  }
}
