/// Plain-text table rendering.
///
/// {@link io.quicktile.util.table.TableFormatter} lays out rows supplied through
/// {@link io.quicktile.util.table.TableRows} using the settings of a
/// {@link io.quicktile.util.table.TableStyle}.
package io.quicktile.util.table;

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
