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

package chunkstream.core;

import org.jspecify.annotations.Nullable;
import reactor.core.publisher.Signal;

/**
 * A pull-based asynchronous sequence of {@code T}, driven by repeated calls to
 * {@link #poll(Waker)}.
 * <p>
 * Each poll reports one of:
 * <ul>
 *     <li>{@code null}: nothing is available yet. The source must arrange for the given
 *     {@link Waker} to be {@link Waker#wake() woken} once it can make progress,</li>
 *     <li>{@link Signal#next(Object)}: a new element,</li>
 *     <li>{@link Signal#complete()}: the sequence is exhausted,</li>
 *     <li>{@link Signal#error(Throwable)}: the sequence failed.</li>
 * </ul>
 * Polls must be performed sequentially by a single driver. Sources are not required to
 * behave once terminated, see {@link FusedSource} for that guarantee.
 *
 * @param <T> the type of the produced elements
 */
@FunctionalInterface
public interface PollableSource<T> {

	/**
	 * Attempt to pull the next signal out of this source.
	 *
	 * @param waker the {@link Waker} to notify when a {@code null} poll can be retried
	 * @return the next {@link Signal}, or {@code null} if the source is not ready
	 */
	@Nullable
	Signal<T> poll(Waker waker);

	/**
	 * Whether the next {@link #poll(Waker)} is known to report completion or failure
	 * without producing any element. Drivers use this to deliver termination without
	 * waiting for demand.
	 * <p>
	 * Defaults to {@code false}, in which case termination is only observed by polling.
	 *
	 * @return {@code true} if the next poll is guaranteed to be terminal
	 */
	default boolean isDrained() {
		return false;
	}
}
