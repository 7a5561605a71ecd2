/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.querypipe.data;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.module.SimpleModule;
import java.io.IOException;
import java.util.List;
import org.querypipe.common.exception.EvaluationException;

/**
 * Canonical JSON encoding of values. Equal values, under {@link Values#equal}, encode to equal
 * bytes: numbers are canonicalised first and object members are written in key order.
 */
public final class ValueMarshaller {

  /** Member of the object MISSING is encoded as. */
  public static final String MISSING_MEMBER = "$missing";

  private static final ObjectMapper MAPPER = createMapper();

  private ValueMarshaller() {}

  /** Mapper shared by key encoding and spill files. */
  public static ObjectMapper mapper() {
    return MAPPER;
  }

  public static byte[] marshal(Object value) {
    try {
      return MAPPER.writeValueAsBytes(Values.canonical(value));
    } catch (JsonProcessingException e) {
      throw new EvaluationException("Unable to encode value " + value, e);
    }
  }

  public static String marshalToString(Object value) {
    try {
      return MAPPER.writeValueAsString(Values.canonical(value));
    } catch (JsonProcessingException e) {
      throw new EvaluationException("Unable to encode value " + value, e);
    }
  }

  /** Encodes a composite key: a single value as is, several values as an array. */
  public static byte[] marshalKey(List<Object> values) {
    return marshal(values.size() == 1 ? values.get(0) : values);
  }

  private static ObjectMapper createMapper() {
    SimpleModule module = new SimpleModule("querypipe-values");
    module.addSerializer(Values.Missing.class, new MissingSerializer());
    ObjectMapper mapper = new ObjectMapper();
    mapper.configure(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS, true);
    mapper.registerModule(module);
    return mapper;
  }

  private static class MissingSerializer extends JsonSerializer<Values.Missing> {
    @Override
    public void serialize(Values.Missing value, JsonGenerator gen, SerializerProvider provider)
        throws IOException {
      gen.writeStartObject();
      gen.writeBooleanField(MISSING_MEMBER, true);
      gen.writeEndObject();
    }
  }
}
