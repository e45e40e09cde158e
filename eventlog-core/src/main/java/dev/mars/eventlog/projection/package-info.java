/*
 * Copyright 2026 Mark Andrew Ray-Smith
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
/**
 * Named read models folded from the event log.
 * <p>
 * A {@link dev.mars.eventlog.projection.Projection} carries an explicit dispatch
 * table built at registration time; the
 * {@link dev.mars.eventlog.projection.ProjectionEngine} replays history into new
 * projections and applies each appended event in global order.
 */
package dev.mars.eventlog.projection;
