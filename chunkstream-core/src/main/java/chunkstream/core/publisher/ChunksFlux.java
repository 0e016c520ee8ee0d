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

package chunkstream.core.publisher;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

import chunkstream.core.ChunksException;
import chunkstream.core.PollableSource;
import org.reactivestreams.Publisher;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * Entry points exposing {@link chunkstream.core.Chunks} batching as a {@link Flux}.
 * <p>
 * The returned {@link Flux} emits a {@link List} each time {@code maxSize} elements have
 * been received, or {@code maxWait} after the first element of a partial list was
 * received, whichever happens first. A last partial list is emitted when the source
 * completes. Failures reach the subscriber as a {@link ChunksException}, after the
 * elements buffered when they happened.
 * <p>
 * Source elements are only pulled into a batch while the subscriber has outstanding
 * demand. Without demand they stay queued, up to the prefetch, and the deadline of the
 * next batch starts once demand resumes. Completion and failure do not wait for demand
 * once the source reports it is {@link chunkstream.core.PollableSource#isDrained() drained}.
 */
public final class ChunksFlux {

	/**
	 * Batch the given {@link Publisher}, timing deadlines on {@link Schedulers#parallel()}.
	 *
	 * @param source the {@link Publisher} to batch
	 * @param maxSize the maximum size of a batch
	 * @param maxWait the maximum delay between the first element of a batch and its release
	 * @param <T> the type of the batched elements
	 * @return a {@link Flux} of batches
	 */
	public static <T> Flux<List<T>> chunks(Publisher<? extends T> source, int maxSize, Duration maxWait) {
		return chunks(source, maxSize, maxWait, Schedulers.parallel());
	}

	/**
	 * Batch the given {@link Publisher}, timing deadlines on the given {@link Scheduler}.
	 *
	 * @param source the {@link Publisher} to batch
	 * @param maxSize the maximum size of a batch
	 * @param maxWait the maximum delay between the first element of a batch and its release
	 * @param timer the {@link Scheduler} timing batch deadlines
	 * @param <T> the type of the batched elements
	 * @return a {@link Flux} of batches
	 */
	public static <T> Flux<List<T>> chunks(Publisher<? extends T> source,
			int maxSize,
			Duration maxWait,
			Scheduler timer) {
		return chunks(source, maxSize, maxWait, timer, PublisherSource.DEFAULT_PREFETCH);
	}

	/**
	 * Batch the given {@link Publisher}, timing deadlines on the given {@link Scheduler}
	 * and requesting up to {@code prefetch} elements ahead from the source.
	 *
	 * @param source the {@link Publisher} to batch
	 * @param maxSize the maximum size of a batch
	 * @param maxWait the maximum delay between the first element of a batch and its release
	 * @param timer the {@link Scheduler} timing batch deadlines
	 * @param prefetch the number of source elements requested ahead
	 * @param <T> the type of the batched elements
	 * @return a {@link Flux} of batches
	 */
	public static <T> Flux<List<T>> chunks(Publisher<? extends T> source,
			int maxSize,
			Duration maxWait,
			Scheduler timer,
			int prefetch) {
		Objects.requireNonNull(source, "source");
		if (prefetch <= 0) {
			throw new IllegalArgumentException("prefetch must be strictly positive, was " + prefetch);
		}
		return new FluxChunks<>(ctx -> PublisherSource.subscribe(source, prefetch, ctx),
				maxSize,
				maxWait,
				timer);
	}

	/**
	 * Batch a {@link PollableSource} obtained from the given {@link Supplier} for each
	 * subscription, timing deadlines on the given {@link Scheduler}.
	 *
	 * @param sourceSupplier supplies a fresh {@link PollableSource} per subscription
	 * @param maxSize the maximum size of a batch
	 * @param maxWait the maximum delay between the first element of a batch and its release
	 * @param timer the {@link Scheduler} timing batch deadlines
	 * @param <T> the type of the batched elements
	 * @return a {@link Flux} of batches
	 */
	public static <T> Flux<List<T>> fromSource(Supplier<? extends PollableSource<? extends T>> sourceSupplier,
			int maxSize,
			Duration maxWait,
			Scheduler timer) {
		Objects.requireNonNull(sourceSupplier, "sourceSupplier");
		return new FluxChunks<>(ctx -> sourceSupplier.get(), maxSize, maxWait, timer);
	}

	ChunksFlux() { }
}
