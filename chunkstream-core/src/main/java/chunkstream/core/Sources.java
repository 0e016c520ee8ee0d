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

import java.util.Iterator;
import java.util.Objects;

import org.jspecify.annotations.Nullable;
import reactor.core.Exceptions;
import reactor.core.publisher.Signal;

/**
 * Factories for simple {@link PollableSource} implementations that are always ready.
 */
public final class Sources {

	/**
	 * Create a {@link PollableSource} that produces the elements of an {@link Iterable}
	 * then completes. A failure of the iterator is reported as an error {@link Signal}.
	 *
	 * @param iterable the {@link Iterable} to pull from
	 * @param <T> the type of the produced elements
	 * @return a new {@link PollableSource}
	 */
	public static <T> PollableSource<T> fromIterable(Iterable<? extends T> iterable) {
		Objects.requireNonNull(iterable, "iterable");
		return new IterableSource<>(iterable);
	}

	/**
	 * Create a {@link PollableSource} that fails immediately with the given error.
	 *
	 * @param error the failure to report
	 * @param <T> the type of the (absent) elements
	 * @return a new failing {@link PollableSource}
	 */
	public static <T> PollableSource<T> error(Throwable error) {
		Objects.requireNonNull(error, "error");
		return new TerminalSource<>(error);
	}

	/**
	 * Create a {@link PollableSource} that completes immediately.
	 *
	 * @param <T> the type of the (absent) elements
	 * @return an empty {@link PollableSource}
	 */
	public static <T> PollableSource<T> empty() {
		return new TerminalSource<>(null);
	}

	static final class IterableSource<T> implements PollableSource<T> {

		final Iterable<? extends T> iterable;

		@Nullable Iterator<? extends T> iterator;

		IterableSource(Iterable<? extends T> iterable) {
			this.iterable = iterable;
		}

		@Override
		public Signal<T> poll(Waker waker) {
			try {
				Iterator<? extends T> it = iterator;
				if (it == null) {
					it = iterable.iterator();
					iterator = it;
				}
				if (it.hasNext()) {
					return Signal.next(Objects.requireNonNull(it.next(),
							"The iterator returned a null value"));
				}
				return Signal.complete();
			}
			catch (Throwable t) {
				Exceptions.throwIfFatal(t);
				return Signal.error(t);
			}
		}

		@Override
		public boolean isDrained() {
			try {
				Iterator<? extends T> it = iterator;
				if (it == null) {
					it = iterable.iterator();
					iterator = it;
				}
				return !it.hasNext();
			}
			catch (Throwable t) {
				Exceptions.throwIfFatal(t);
				// the next poll hits the same failure
				return true;
			}
		}

		@Override
		public String toString() {
			return "IterableSource{" + iterable + "}";
		}
	}

	static final class TerminalSource<T> implements PollableSource<T> {

		final @Nullable Throwable error;

		TerminalSource(@Nullable Throwable error) {
			this.error = error;
		}

		@Override
		public Signal<T> poll(Waker waker) {
			Throwable e = error;
			return e != null ? Signal.error(e) : Signal.complete();
		}

		@Override
		public boolean isDrained() {
			return true;
		}

		@Override
		public String toString() {
			return error != null ? "TerminalSource{" + error + "}" : "TerminalSource{complete}";
		}
	}

	Sources() { }
}
