package se.kth.castor.deepcheck.documents;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import se.kth.castor.deepcheck.documents.MalformedDocumentException.Side;

class YamlEquivalenceTest {

  private final YamlEquivalence yaml = new YamlEquivalence();

  @Test
  void testKeyOrderAndLayoutAreIrrelevant() throws MalformedDocumentException {
    String expected = """
        name: deepcheck
        tags:
          - a
          - b
        nested:
          count: 2
        """;
    String actual = """
        nested: {count: 2.0}
        tags: [a, b]
        name: deepcheck
        """;

    assertThat(yaml.equivalent(expected, actual)).isTrue();
  }

  @Test
  void testYamlAcceptsJson() throws MalformedDocumentException {
    assertThat(yaml.equivalent("{\"a\": [1, 2]}", "a:\n  - 1\n  - 2\n")).isTrue();
  }

  @Test
  void testDifferentContent() throws MalformedDocumentException {
    assertThat(yaml.equivalent("a: 1", "a: 2")).isFalse();
    assertThat(yaml.equivalent("[1, 2]", "[2, 1]")).isFalse();
    assertThat(yaml.equivalent("a: 1", "b: 1")).isFalse();
  }

  @Test
  void testEmptyDocumentIsNull() throws MalformedDocumentException {
    assertThat(yaml.equivalent("", "~")).isTrue();
    assertThat(yaml.equivalent("", "a: 1")).isFalse();
  }

  @Test
  void testParseNormalizesNumbers() throws MalformedDocumentException {
    Object parsed = yaml.parse(Side.EXPECTED, "values: [1, 2.5]\nflag: true\n");

    assertThat(parsed).isEqualTo(Map.of("values", List.of(1.0, 2.5), "flag", true));
  }

  @Test
  void testMalformedDocument() {
    assertThatThrownBy(() -> yaml.equivalent("a: 1", "key: [unclosed"))
        .isInstanceOf(MalformedDocumentException.class)
        .satisfies(e -> assertThat(((MalformedDocumentException) e).getSide())
            .isEqualTo(Side.ACTUAL));
  }
}
