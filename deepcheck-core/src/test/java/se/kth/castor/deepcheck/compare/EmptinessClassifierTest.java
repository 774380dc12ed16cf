package se.kth.castor.deepcheck.compare;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

import com.google.common.primitives.UnsignedInteger;
import examples.PojoWithEnumField;
import examples.PojoWithEnumField.Peano;
import examples.PojoWithPrimitives;
import examples.RecordWithHiddenComponent;
import examples.TrivialPojo;
import java.math.BigDecimal;
import java.util.ArrayDeque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

class EmptinessClassifierTest {

  @ParameterizedTest
  @MethodSource("emptyValues")
  void testEmpty(Object value) {
    assertThat(EmptinessClassifier.isEmpty(value)).isTrue();
  }

  @ParameterizedTest
  @MethodSource("nonEmptyValues")
  void testNotEmpty(Object value) {
    assertThat(EmptinessClassifier.isEmpty(value)).isFalse();
  }

  private static Stream<Object> emptyValues() {
    return Stream.of(
        null,
        "",
        '\0',
        false,
        0,
        0L,
        0.0,
        -0.0,
        UnsignedInteger.ZERO,
        new BigDecimal("0.00"),
        List.of(),
        new int[0],
        new byte[0],
        Map.of(),
        Set.of(),
        new ArrayDeque<>(),
        Optional.empty(),
        new AtomicReference<>(),
        Optional.of(""),
        Optional.of(Optional.empty()),
        new TrivialPojo(),
        PojoWithPrimitives.zero(),
        new RecordWithHiddenComponent(null, 0.0, null)
    );
  }

  private static Stream<Object> nonEmptyValues() {
    return Stream.of(
        "a",
        'a',
        true,
        1,
        Double.NaN,
        List.of(0),
        new int[]{0},
        new byte[]{0},
        Map.of("", ""),
        Optional.of(1),
        new AtomicReference<>("x"),
        new TrivialPojo(null, 0, "secret"),
        new RecordWithHiddenComponent(null, 0.0, "key"),
        new PojoWithEnumField(Peano.ZERO),
        UUID.randomUUID(),
        Peano.ZERO
    );
  }

  @Test
  void testBoxedZeroInAReferenceFieldIsNotTheZeroValue() {
    PojoWithPrimitives pojo = PojoWithPrimitives.zero();
    pojo.boxed = 0L;

    assertThat(EmptinessClassifier.isEmpty(pojo)).isFalse();
  }

  @Test
  void testNegativeZeroInAPrimitiveFieldIsZero() {
    PojoWithPrimitives pojo = PojoWithPrimitives.zero();
    pojo.ratio = -0.0f;

    assertThat(EmptinessClassifier.isEmpty(pojo)).isTrue();
  }

  @Test
  void testCallablesAreNeverEmpty() {
    Runnable runnable = () -> {
    };

    assertThat(EmptinessClassifier.isEmpty(runnable)).isFalse();
    assertThat(EmptinessClassifier.isEmpty(mock(Supplier.class))).isFalse();
  }
}
