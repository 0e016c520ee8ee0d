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

/**
 * The failure reported by {@link Chunks}, tagged with what failed: the wrapped
 * {@link Kind#INNER source} or the {@link Kind#TIMER deadline timer}. The original
 * failure is always available as the {@link #getCause() cause}.
 */
public final class ChunksException extends RuntimeException {

	private static final long serialVersionUID = 4312889127615447207L;

	/**
	 * What failed.
	 */
	public enum Kind {
		/**
		 * The wrapped source failed.
		 */
		INNER,
		/**
		 * The deadline timer failed.
		 */
		TIMER
	}

	/**
	 * Wrap a failure of the batched source.
	 *
	 * @param cause the source failure
	 * @return a {@link Kind#INNER} {@link ChunksException}
	 */
	public static ChunksException inner(Throwable cause) {
		return new ChunksException(Kind.INNER, cause);
	}

	/**
	 * Wrap a failure of the deadline timer.
	 *
	 * @param cause the timer failure
	 * @return a {@link Kind#TIMER} {@link ChunksException}
	 */
	public static ChunksException timer(Throwable cause) {
		return new ChunksException(Kind.TIMER, cause);
	}

	/**
	 * Return the original failure if the given {@link Throwable} is a
	 * {@link ChunksException}, or the throwable itself otherwise.
	 *
	 * @param t the throwable to unwrap
	 * @return the unwrapped failure
	 */
	public static Throwable unwrap(Throwable t) {
		Throwable cause = t.getCause();
		if (t instanceof ChunksException && cause != null) {
			return cause;
		}
		return t;
	}

	final Kind kind;

	ChunksException(Kind kind, Throwable cause) {
		super(kind == Kind.INNER ? "Source failed: " + cause : "Timer failed: " + cause,
				Objects.requireNonNull(cause, "cause"));
		this.kind = kind;
	}

	/**
	 * @return the {@link Kind} of failure
	 */
	public Kind kind() {
		return kind;
	}

	/**
	 * @return {@code true} if the wrapped source failed
	 */
	public boolean isInner() {
		return kind == Kind.INNER;
	}

	/**
	 * @return {@code true} if the deadline timer failed
	 */
	public boolean isTimer() {
		return kind == Kind.TIMER;
	}
}
