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

/// Simulation-based power analysis for PSE experiments.
///
/// ## Pipeline
///
/// ```text
/// FixedEffectSet ─┐
///                 ▼
///   DesignGenerator → ResponseSimulator → QualityDegrader
///                 → PseEstimator → EffectSizeAnalyzer
///                 ▼
///   PowerEngine accumulates Cohen's f per effect over replications
/// ```
///
/// ## Packages
///
/// - `model` - trial records, coefficient table, estimates, effect sizes
/// - `design` - factorial design generation
/// - `simulate` - response sampling, missing-data injection, random streams
/// - `estimate` - per-group logistic fits and PSE extraction
/// - `analyze` - repeated-measures ANOVA and Cohen's f
/// - `engine` - replication loop and result accumulation
/// - `codec` - JSON form of the coefficient table
package io.nosqlbench.powersim;
