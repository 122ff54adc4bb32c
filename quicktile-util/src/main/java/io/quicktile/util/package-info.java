/// General helpers shared across QuickTile.
///
/// - {@link io.quicktile.util.Indices}: wrap or saturate indices into a half-open range
/// - {@link io.quicktile.util.Powerset}: lazy enumeration of all subsets of a collection
/// - {@link io.quicktile.util.ExternalInitException}: failures whose cause lies outside QuickTile
///
/// Table rendering lives in {@link io.quicktile.util.table}, and the type-partitioned
/// map in {@link io.quicktile.util.collections}.
package io.quicktile.util;

/*
 * Copyright (c) quicktile
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
