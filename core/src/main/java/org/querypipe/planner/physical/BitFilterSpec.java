/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.querypipe.planner.physical;

import java.util.List;
import org.querypipe.expression.Expression;

/**
 * Identifies a bit filter shared between a join build side and a probe side.
 *
 * @param alias build side alias
 * @param indexId probe side index id
 * @param expressions key expressions, evaluated on the side that uses the spec
 * @param estimatedCardinality expected number of build keys, sizes the bloom filter
 */
public record BitFilterSpec(
    String alias, String indexId, List<Expression> expressions, long estimatedCardinality) {

  public BitFilterSpec {
    expressions = List.copyOf(expressions);
  }
}
