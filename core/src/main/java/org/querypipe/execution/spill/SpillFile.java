/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.querypipe.execution.spill;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import lombok.Getter;
import lombok.extern.log4j.Log4j2;
import org.querypipe.common.exception.ErrorCode;
import org.querypipe.common.exception.QueryEngineException;
import org.querypipe.data.Tuple;
import org.querypipe.data.ValueMarshaller;
import org.querypipe.data.Values;

/**
 * Temporary file holding a run of tuples as a JSON array. A file is written once, then read any
 * number of times, then deleted.
 */
@Log4j2
public class SpillFile implements Closeable {

  private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE =
      new TypeReference<>() {};

  private static final String ID = "id";
  private static final String FIELDS = "fields";
  private static final String ATTACHMENTS = "attachments";

  @Getter private final Path path;
  private final ObjectMapper mapper = ValueMarshaller.mapper();
  private JsonGenerator generator;
  @Getter private long count;

  private SpillFile(Path path) {
    this.path = path;
  }

  /** Creates an empty spill file open for writing. */
  public static SpillFile create(String prefix) {
    try {
      SpillFile file = new SpillFile(Files.createTempFile("querypipe-" + prefix + "-", ".json"));
      file.generator =
          file.mapper
              .getFactory()
              .createGenerator(new BufferedOutputStream(Files.newOutputStream(file.path)));
      file.generator.writeStartArray();
      return file;
    } catch (IOException e) {
      throw spillError("Unable to create spill file", e);
    }
  }

  public void write(Tuple tuple) {
    Map<String, Object> record = new LinkedHashMap<>(4);
    if (tuple.getId() != null) {
      record.put(ID, tuple.getId());
    }
    record.put(FIELDS, tuple.getFields());
    if (!tuple.getAttachments().isEmpty()) {
      record.put(ATTACHMENTS, tuple.getAttachments());
    }
    try {
      mapper.writeValue(generator, record);
      count++;
    } catch (IOException e) {
      throw spillError("Unable to write spill file " + path, e);
    }
  }

  /** Finishes writing. */
  public void finish() {
    if (generator == null) {
      return;
    }
    try {
      generator.writeEndArray();
      generator.close();
    } catch (IOException e) {
      throw spillError("Unable to finish spill file " + path, e);
    } finally {
      generator = null;
    }
  }

  /** Reads the tuples back in write order. The iterator must be closed. */
  public TupleReader read() {
    finish();
    try {
      JsonParser parser =
          mapper.getFactory().createParser(new BufferedInputStream(Files.newInputStream(path)));
      if (parser.nextToken() != JsonToken.START_ARRAY) {
        parser.close();
        throw spillError("Corrupt spill file " + path, null);
      }
      return new TupleReader(parser);
    } catch (IOException e) {
      throw spillError("Unable to read spill file " + path, e);
    }
  }

  @Override
  public void close() {
    if (generator != null) {
      try {
        generator.close();
      } catch (IOException e) {
        log.warn("Error closing spill file {}", path, e);
      }
      generator = null;
    }
    try {
      Files.deleteIfExists(path);
    } catch (IOException e) {
      log.warn("Error deleting spill file {}", path, e);
    }
  }

  // numbers come back as the narrowest type Jackson finds, MISSING as its marker object
  static Object restore(Object value) {
    if (value instanceof Map) {
      Map<?, ?> map = (Map<?, ?>) value;
      if (map.size() == 1 && Boolean.TRUE.equals(map.get(ValueMarshaller.MISSING_MEMBER))) {
        return Values.MISSING;
      }
      Map<String, Object> result = new LinkedHashMap<>(map.size());
      map.forEach((k, v) -> result.put(String.valueOf(k), restore(v)));
      return result;
    }
    if (value instanceof List) {
      List<?> list = (List<?>) value;
      List<Object> result = new ArrayList<>(list.size());
      list.forEach(v -> result.add(restore(v)));
      return result;
    }
    return Values.canonical(value);
  }

  static QueryEngineException spillError(String message, Throwable cause) {
    return new QueryEngineException(
        ErrorCode.SPILL, QueryEngineException.Severity.FATAL, message, cause);
  }

  /** Iterator over the tuples of a spill file. */
  public class TupleReader implements Iterator<Tuple>, Closeable {

    private final JsonParser parser;
    private Tuple next;
    private boolean done;

    private TupleReader(JsonParser parser) {
      this.parser = parser;
    }

    @Override
    public boolean hasNext() {
      if (next == null && !done) {
        next = advance();
      }
      return next != null;
    }

    @Override
    public Tuple next() {
      if (!hasNext()) {
        throw new NoSuchElementException();
      }
      Tuple result = next;
      next = null;
      return result;
    }

    @SuppressWarnings("unchecked")
    private Tuple advance() {
      try {
        if (parser.nextToken() != JsonToken.START_OBJECT) {
          done = true;
          return null;
        }
        Map<String, Object> record = mapper.readValue(parser, MAP_TYPE);
        Tuple tuple = new Tuple((Map<String, Object>) restore(record.get(FIELDS)));
        tuple.setId((String) record.get(ID));
        Object attachments = record.get(ATTACHMENTS);
        if (attachments != null) {
          ((Map<String, Object>) restore(attachments)).forEach(tuple::setAttachment);
        }
        return tuple;
      } catch (IOException e) {
        throw spillError("Unable to read spill file " + path, e);
      }
    }

    @Override
    public void close() {
      try {
        parser.close();
      } catch (IOException e) {
        log.warn("Error closing spill file reader {}", path, e);
      }
    }
  }
}
