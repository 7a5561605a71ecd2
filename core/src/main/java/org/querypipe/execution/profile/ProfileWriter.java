/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.querypipe.execution.profile;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.util.Map;
import lombok.experimental.UtilityClass;
import org.querypipe.common.exception.ExecutionInternalException;
import org.querypipe.execution.Operator;

/** Renders operator profiles as JSON, keeping the order of the profile document. */
@UtilityClass
public class ProfileWriter {

  private static final ObjectMapper MAPPER =
      new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

  public static String write(Operator operator) {
    return write(operator.profile());
  }

  public static String write(Map<String, Object> profile) {
    try {
      return MAPPER.writeValueAsString(profile);
    } catch (JsonProcessingException e) {
      throw new ExecutionInternalException("Unable to render profile", e);
    }
  }
}
