/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.querypipe.execution.spill;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;
import org.querypipe.data.Tuple;
import org.querypipe.data.Values;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class SpillFileTest {

  @Test
  void tuples_read_back_in_write_order() {
    try (SpillFile file = SpillFile.create("test")) {
      // Given
      for (long i = 0; i < 100; i++) {
        file.write(Tuple.of("k" + i, Map.of("i", i, "half", i / 2.0)));
      }

      // When
      List<Tuple> read = new ArrayList<>();
      try (SpillFile.TupleReader reader = file.read()) {
        reader.forEachRemaining(read::add);
      }

      // Then
      assertEquals(100L, file.getCount());
      assertEquals(100, read.size());
      assertEquals("k42", read.get(42).getId());
      assertEquals(42L, read.get(42).getField("i"));
      assertEquals(21L, read.get(42).getField("half"));
      assertEquals(21.5, read.get(43).getField("half"));
    }
  }

  @Test
  void nested_values_nulls_and_missing_survive() {
    Map<String, Object> fields = new LinkedHashMap<>();
    fields.put("obj", Map.of("list", List.of(1L, "two")));
    fields.put("none", null);
    Tuple tuple = Tuple.of(fields);
    tuple.setAttachment("sortValues", Arrays.asList(Values.MISSING, 3L));

    try (SpillFile file = SpillFile.create("test");
        SpillFile.TupleReader reader = writeAndRead(file, tuple)) {
      Tuple restored = reader.next();

      assertNull(restored.getId());
      assertEquals(List.of(1L, "two"), restored.getField("obj.list"));
      assertTrue(restored.getFields().containsKey("none"));
      List<?> sortValues = (List<?>) restored.getAttachment("sortValues");
      assertSame(Values.MISSING, sortValues.get(0));
      assertFalse(reader.hasNext());
      assertThrows(NoSuchElementException.class, reader::next);
    }
  }

  @Test
  void empty_file_reads_nothing() {
    try (SpillFile file = SpillFile.create("test");
        SpillFile.TupleReader reader = file.read()) {
      assertFalse(reader.hasNext());
    }
  }

  private static SpillFile.TupleReader writeAndRead(SpillFile file, Tuple tuple) {
    file.write(tuple);
    return file.read();
  }
}
