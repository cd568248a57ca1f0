/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

/// Data model of the power simulation.
///
/// ## Trial-level data
///
/// - [io.nosqlbench.powersim.model.TrialShell]: one design cell
/// - [io.nosqlbench.powersim.model.TrialRecord]: a cell with its response
///
/// ## Model inputs
///
/// - [io.nosqlbench.powersim.model.DesignTerm]: the enumerated design matrix
/// - [io.nosqlbench.powersim.model.FixedEffectSet]: coefficients per term
///
/// ## Per-replication outputs
///
/// - [io.nosqlbench.powersim.model.PseEstimate]
/// - [io.nosqlbench.powersim.model.EffectSizeRecord]
package io.nosqlbench.powersim.model;
