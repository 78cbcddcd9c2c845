/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.dataframe.engine.planner.logical;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.DisplayNameGeneration;
import org.junit.jupiter.api.DisplayNameGenerator;
import org.junit.jupiter.api.Test;

@DisplayNameGeneration(DisplayNameGenerator.ReplaceUnderscores.class)
class LogicalPlanNodeVisitorTest {

  @Test
  void should_require_a_visit_method_for_every_node_type() {
    List<Method> nodeVisits =
        Arrays.stream(LogicalPlanNodeVisitor.class.getDeclaredMethods())
            .filter(method -> method.getName().startsWith("visit"))
            .filter(method -> !method.getName().equals("visitNode"))
            .collect(Collectors.toList());

    assertEquals(14, nodeVisits.size());
    nodeVisits.forEach(
        method ->
            assertTrue(Modifier.isAbstract(method.getModifiers()), method.getName()));
  }

  @Test
  void should_keep_fallback_for_foreign_plan_types() throws NoSuchMethodException {
    Method visitNode =
        LogicalPlanNodeVisitor.class.getDeclaredMethod(
            "visitNode", LogicalPlan.class, Object.class);

    assertFalse(Modifier.isAbstract(visitNode.getModifiers()));
  }
}
