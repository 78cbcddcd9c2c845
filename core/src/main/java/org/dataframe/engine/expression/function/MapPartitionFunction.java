/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.dataframe.engine.expression.function;

import org.dataframe.engine.data.page.Page;

/** User function applied to a whole partition. Implementations must not mutate the input. */
@FunctionalInterface
public interface MapPartitionFunction {

  Page apply(Page partition);
}
