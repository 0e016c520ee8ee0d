/*
 * Copyright (c) 2026 VMware Inc. or its affiliates, All Rights Reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

/**
 * Reactive Streams integration: {@link chunkstream.core.publisher.ChunksFlux} turns any
 * {@link org.reactivestreams.Publisher} into a {@link reactor.core.publisher.Flux} of
 * batches driven by a {@link chunkstream.core.Chunks} adaptor.
 */
@NullMarked
package chunkstream.core.publisher;

import org.jspecify.annotations.NullMarked;
