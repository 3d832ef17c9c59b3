package com.ospicorp.heartrate.ingestion.source;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertSame;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.TextNode;
import java.util.List;
import java.util.stream.IntStream;
import org.junit.jupiter.api.Test;

class PerturbationTest {

  private static List<JsonNode> values(int... bpm) {
    return IntStream.of(bpm).<JsonNode>mapToObj(IntNode::valueOf).toList();
  }

  private static List<Integer> ints(List<JsonNode> nodes) {
    return nodes.stream().map(JsonNode::asInt).toList();
  }

  @Test
  void rotationShiftsValuesBySeedModuloSize() {
    List<JsonNode> rotated = new ValueRotation(7).apply(values(60, 61, 62, 63, 64));
    assertThat(ints(rotated)).containsExactly(62, 63, 64, 60, 61);
  }

  @Test
  void zeroSeedLeavesValuesUntouched() {
    List<JsonNode> input = values(60, 61, 62);
    assertSame(input, new ValueRotation(0).apply(input));
    assertSame(input, new BoundedJitter(0).apply(input));
    assertSame(input, PerturbationPolicy.JITTER.forSeed(0).apply(input));
  }

  @Test
  void jitterIsReproducibleForSameSeed() {
    List<JsonNode> input = values(70, 80, 90, 100, 110, 120);
    assertThat(new BoundedJitter(42).apply(input)).isEqualTo(new BoundedJitter(42).apply(input));
    assertThat(new BoundedJitter(42).apply(input)).isNotEqualTo(new BoundedJitter(43).apply(input));
  }

  @Test
  void jitterStaysWithinBoundsAndTwoDecimals() {
    List<JsonNode> input = values(45, 52, 120, 198, 230);
    List<JsonNode> output = new BoundedJitter(99).apply(input);

    assertThat(output).hasSize(input.size());
    for (int i = 0; i < input.size(); i++) {
      double value = output.get(i).asDouble();
      assertThat(value).isBetween(BoundedJitter.MIN_BPM, BoundedJitter.MAX_BPM);
      assertThat(Math.round(value * 100) / 100.0).isEqualTo(value);
    }
    assertThat(output.get(2).asDouble()).isBetween(115.0, 125.0);
  }

  @Test
  void jitterPassesNonNumericValuesThrough() {
    List<JsonNode> input = List.of(IntNode.valueOf(80), TextNode.valueOf("abc"), IntNode.valueOf(81));
    List<JsonNode> output = new BoundedJitter(5).apply(input);
    assertThat(output.get(1).asText()).isEqualTo("abc");
  }

  @Test
  void policyParsingIsCaseInsensitiveAndRejectsUnknownNames() {
    assertThat(PerturbationPolicy.parse("Rotate")).isEqualTo(PerturbationPolicy.ROTATE);
    assertThat(PerturbationPolicy.parse(" ")).isEqualTo(PerturbationPolicy.JITTER);
    assertThat(PerturbationPolicy.ROTATE.forSeed(3)).isInstanceOf(ValueRotation.class);
    assertThatThrownBy(() -> PerturbationPolicy.parse("shuffle"))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("shuffle");
  }
}
