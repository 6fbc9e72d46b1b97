package com.github.adamzv.kafkasearch.domain;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class PartitionTest {

  @Test
  void serializesAsCompactJson() {
    Partition partition = new Partition("orders", 3, 10, 42, 12, "status=paid");

    assertEquals(
        "{\"topic\":\"orders\",\"partition\":3,\"start\":10,\"end\":42,\"offset\":12,\"filter\":\"status=paid\"}",
        partition.toString()
    );
  }

  @Test
  void parsesItsOwnStringForm() {
    Partition partition = Partition.of("orders", 1, 5, 9).withOffset(7);

    assertEquals(partition, Partition.parse(partition.toString()));
  }

  @Test
  void startsCursorAtOldestOffset() {
    Partition partition = Partition.of("orders", 0, 100, 250);

    assertEquals(100L, partition.offset());
    assertEquals(150L, partition.remaining());
    assertEquals("", partition.filter());
    assertFalse(partition.isExhausted());
  }

  @Test
  void emptyPartitionIsExhausted() {
    assertTrue(Partition.of("orders", 0, 7, 7).isExhausted());
  }

  @Test
  void rejectsCursorOutsideRange() {
    Partition partition = Partition.of("orders", 0, 5, 9);

    assertThrows(IllegalArgumentException.class, () -> partition.withOffset(4));
    assertThrows(IllegalArgumentException.class, () -> partition.withOffset(10));
    assertEquals(9L, partition.withOffset(9).offset());
  }

  @Test
  void rejectsStartAfterEnd() {
    assertThrows(IllegalArgumentException.class, () -> Partition.of("orders", 0, 10, 9));
  }

  @Test
  void rejectsBlankTopic() {
    assertThrows(IllegalArgumentException.class, () -> Partition.of(" ", 0, 0, 1));
  }

  @Test
  void malformedInputIsInvalidArgument() {
    ProblemException exception = assertThrows(ProblemException.class, () -> Partition.parse("{not json"));
    assertEquals(ProblemCodes.INVALID_ARGUMENT, exception.problem().code());
  }

  @Test
  void parsedPartitionMustSatisfyRangeInvariant() {
    String json = "{\"topic\":\"orders\",\"partition\":0,\"start\":5,\"end\":9,\"offset\":20,\"filter\":\"\"}";

    ProblemException exception = assertThrows(ProblemException.class, () -> Partition.parse(json));
    assertEquals(ProblemCodes.INVALID_ARGUMENT, exception.problem().code());
  }
}
