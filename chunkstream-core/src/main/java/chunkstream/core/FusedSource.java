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

import java.util.Objects;

import org.jspecify.annotations.Nullable;
import reactor.core.Disposable;
import reactor.core.publisher.Signal;

/**
 * A {@link PollableSource} that is never polled again once it has signalled completion
 * or failure. Every subsequent {@link #poll(Waker)} reports {@link Signal#complete()}.
 *
 * @param <T> the type of the produced elements
 */
public final class FusedSource<T> implements PollableSource<T>, Disposable {

	/**
	 * Fuse the given source, unless it already is a {@link FusedSource}.
	 *
	 * @param source the source to fuse
	 * @param <T> the type of the produced elements
	 * @return a {@link FusedSource} over {@code source}
	 */
	@SuppressWarnings("unchecked")
	public static <T> FusedSource<T> fuse(PollableSource<? extends T> source) {
		Objects.requireNonNull(source, "source");
		if (source instanceof FusedSource) {
			return (FusedSource<T>) source;
		}
		return new FusedSource<>(source);
	}

	final PollableSource<? extends T> source;

	boolean terminated;

	FusedSource(PollableSource<? extends T> source) {
		this.source = source;
	}

	@Override
	@SuppressWarnings("unchecked")
	public @Nullable Signal<T> poll(Waker waker) {
		if (terminated) {
			return Signal.complete();
		}
		Signal<T> signal = (Signal<T>) source.poll(waker);
		if (signal != null && (signal.isOnComplete() || signal.isOnError())) {
			terminated = true;
		}
		return signal;
	}

	/**
	 * @return {@code true} once the underlying source signalled completion or failure
	 */
	public boolean isTerminated() {
		return terminated;
	}

	@Override
	public boolean isDrained() {
		return terminated || source.isDrained();
	}

	/**
	 * @return the underlying source
	 */
	public PollableSource<? extends T> get() {
		return source;
	}

	@Override
	public void dispose() {
		terminated = true;
		if (source instanceof Disposable) {
			((Disposable) source).dispose();
		}
	}

	@Override
	public boolean isDisposed() {
		if (source instanceof Disposable) {
			return ((Disposable) source).isDisposed();
		}
		return terminated;
	}

	@Override
	public String toString() {
		return "FusedSource{" + source + (terminated ? ", terminated}" : "}");
	}
}
