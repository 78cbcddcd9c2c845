/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.dataframe.engine.planner.physical.step;

import org.dataframe.engine.planner.ResourceRequest;
import org.dataframe.engine.planner.physical.instruction.Instruction;

/** An instruction attached to a step, with the resources the owning operator asked for. */
public record PipelinedInstruction(Instruction instruction, ResourceRequest resourceRequest) {}
