package io.outlog.domain.context;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.outlog.domain.config.OutlogConfiguration;
import io.outlog.domain.error.InfiniteRecursionException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class RecursionGuardTest {

  @AfterEach
  void tearDown() {
    OutboundLogContext.clear();
  }

  @Test
  void countersAreIndependentPerLibrary() {
    RecursionGuard.increment("okhttp");
    RecursionGuard.increment("okhttp");
    RecursionGuard.increment("spring_rest");

    assertThat(RecursionGuard.currentDepth("okhttp")).isEqualTo(2);
    assertThat(RecursionGuard.currentDepth("spring_rest")).isEqualTo(1);
    assertThat(RecursionGuard.inRecursion("jdk_http_client")).isFalse();
  }

  @Test
  void decrementFloorsAtZeroAndRemovesTheEntry() {
    RecursionGuard.increment("okhttp");

    assertThat(RecursionGuard.decrement("okhttp")).isZero();
    assertThat(RecursionGuard.decrement("okhttp")).isZero();
    assertThat(RecursionGuard.inRecursion("okhttp")).isFalse();
    assertThat(RecursionGuard.isIdle()).isTrue();
  }

  @Test
  void checkDepthIsANoOpWithoutStrictDetection() {
    OutlogConfiguration lenient = OutlogConfiguration.builder().maxRecursionDepth(1).build();
    RecursionGuard.increment("okhttp");
    RecursionGuard.increment("okhttp");

    assertThatCode(() -> RecursionGuard.checkDepth("okhttp", lenient)).doesNotThrowAnyException();
  }

  @Test
  void checkDepthFailsOnceTheLimitIsReachedUnderStrictDetection() {
    OutlogConfiguration strict =
        OutlogConfiguration.builder().maxRecursionDepth(2).strictRecursionDetection(true).build();
    RecursionGuard.increment("okhttp");

    assertThatCode(() -> RecursionGuard.checkDepth("okhttp", strict)).doesNotThrowAnyException();

    RecursionGuard.increment("okhttp");
    assertThatThrownBy(() -> RecursionGuard.checkDepth("okhttp", strict))
        .isInstanceOf(InfiniteRecursionException.class)
        .hasMessageContaining("okhttp")
        .satisfies(e -> assertThat(((InfiniteRecursionException) e).depth()).isEqualTo(2));
  }
}
