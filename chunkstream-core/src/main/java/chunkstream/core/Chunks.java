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

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

import chunkstream.core.timer.Deadline;
import chunkstream.core.timer.DeadlineTimer;
import chunkstream.core.timer.SchedulerDeadlineTimer;
import org.jspecify.annotations.Nullable;
import reactor.core.Disposable;
import reactor.core.Exceptions;
import reactor.core.publisher.Operators;
import reactor.core.publisher.Signal;
import reactor.util.Logger;
import reactor.util.Loggers;

/**
 * Buffers the elements of a {@link PollableSource} into {@link List lists} of at most
 * {@code capacity} elements, releasing a list as soon as it is full or as soon as
 * {@code maxWait} has elapsed since its first element was received, whichever happens
 * first.
 * <p>
 * {@link Chunks} is itself a {@link PollableSource} of lists, driven by
 * {@link #poll(Waker)}:
 * <ul>
 *     <li>{@link Signal#next(Object)} carries a batch. Batches are emitted in source
 *     order and are never empty,</li>
 *     <li>{@link Signal#complete()} once the source is exhausted and the last partial
 *     batch was emitted,</li>
 *     <li>{@link Signal#error(Throwable)} carries a {@link ChunksException}. If elements
 *     were buffered when the source or the timer failed, they are emitted first and the
 *     error is reported by the following poll,</li>
 *     <li>{@code null} when neither the source nor the current deadline is ready. Both
 *     have registered the {@link Waker}, so the driver is woken by whichever is ready
 *     first.</li>
 * </ul>
 * <p>
 * This class is not thread-safe: {@link #poll(Waker)} must be called sequentially by a
 * single driver and never re-entrantly. Only {@link Waker#wake()} may happen on other
 * threads.
 * <p>
 * Disposing the adaptor (or calling {@link #intoInner()}) discards the buffered
 * elements: use {@link #drainRemaining()} beforehand to retrieve them.
 * <p>
 * A {@link DeadlineTimer} created by the adaptor itself is released as soon as a
 * terminal signal is returned, or on disposal. A timer passed to
 * {@link #create(PollableSource, int, Duration, DeadlineTimer)} remains owned by the
 * caller and can be shared by several adaptors: it is never disposed here.
 *
 * @param <T> the type of the batched elements
 */
public final class Chunks<T> implements PollableSource<List<T>>, Disposable {

	static final Logger LOGGER = Loggers.getLogger(Chunks.class);

	/**
	 * Create a {@link Chunks} over the given source, arming its deadlines on a
	 * {@link SchedulerDeadlineTimer} backed by the parallel scheduler.
	 *
	 * @param source the {@link PollableSource} to batch
	 * @param capacity the maximum size of a batch, strictly positive
	 * @param maxWait the maximum delay between the first element of a batch and its release
	 * @param <T> the type of the batched elements
	 * @return a new {@link Chunks}
	 * @throws IllegalArgumentException if {@code capacity} is not strictly positive
	 */
	public static <T> Chunks<T> create(PollableSource<? extends T> source,
			int capacity,
			Duration maxWait) {
		return new Chunks<>(source, capacity, maxWait, SchedulerDeadlineTimer.create(), true, null);
	}

	/**
	 * Create a {@link Chunks} over the given source, arming its deadlines on the given
	 * {@link DeadlineTimer}. The timer is not disposed along with the adaptor.
	 *
	 * @param source the {@link PollableSource} to batch
	 * @param capacity the maximum size of a batch, strictly positive
	 * @param maxWait the maximum delay between the first element of a batch and its release
	 * @param timer the {@link DeadlineTimer} arming batch deadlines
	 * @param <T> the type of the batched elements
	 * @return a new {@link Chunks}
	 * @throws IllegalArgumentException if {@code capacity} is not strictly positive
	 */
	public static <T> Chunks<T> create(PollableSource<? extends T> source,
			int capacity,
			Duration maxWait,
			DeadlineTimer timer) {
		return new Chunks<>(source, capacity, maxWait, timer, false, null);
	}

	/**
	 * Create a {@link Chunks} like {@link #create(PollableSource, int, Duration, DeadlineTimer)},
	 * additionally handing every element discarded on {@link #dispose()} to
	 * {@code onDiscard}.
	 *
	 * @param source the {@link PollableSource} to batch
	 * @param capacity the maximum size of a batch, strictly positive
	 * @param maxWait the maximum delay between the first element of a batch and its release
	 * @param timer the {@link DeadlineTimer} arming batch deadlines
	 * @param onDiscard receives buffered elements dropped by disposal
	 * @param <T> the type of the batched elements
	 * @return a new {@link Chunks}
	 * @throws IllegalArgumentException if {@code capacity} is not strictly positive
	 */
	public static <T> Chunks<T> create(PollableSource<? extends T> source,
			int capacity,
			Duration maxWait,
			DeadlineTimer timer,
			Consumer<? super T> onDiscard) {
		return new Chunks<>(source, capacity, maxWait, timer, false,
				Objects.requireNonNull(onDiscard, "onDiscard"));
	}

	final FusedSource<T>                source;
	final int                           capacity;
	final Duration                      maxWait;
	final long                          maxWaitNanos;
	final DeadlineTimer                 timer;
	final boolean                       ownsTimer;
	final @Nullable Consumer<? super T> onDiscard;

	List<T> buffer;

	/**
	 * Armed if and only if the buffer received its first element since the last flush.
	 */
	@Nullable Deadline deadline;

	@Nullable ChunksException deferredError;

	boolean disposed;

	Chunks(PollableSource<? extends T> source,
			int capacity,
			Duration maxWait,
			DeadlineTimer timer,
			boolean ownsTimer,
			@Nullable Consumer<? super T> onDiscard) {
		if (capacity <= 0) {
			throw new IllegalArgumentException("capacity must be strictly positive, was " + capacity);
		}
		Objects.requireNonNull(maxWait, "maxWait");
		if (maxWait.isNegative()) {
			throw new IllegalArgumentException("maxWait must not be negative, was " + maxWait);
		}
		this.source = FusedSource.fuse(source);
		this.capacity = capacity;
		this.maxWait = maxWait;
		this.maxWaitNanos = saturatedNanos(maxWait);
		this.timer = Objects.requireNonNull(timer, "timer");
		this.ownsTimer = ownsTimer;
		this.onDiscard = onDiscard;
		this.buffer = new ArrayList<>(capacity);
	}

	@Override
	public @Nullable Signal<List<T>> poll(Waker waker) {
		ChunksException e = deferredError;
		if (e != null) {
			deferredError = null;
			return terminate(Signal.error(e));
		}
		if (disposed) {
			return Signal.complete();
		}

		for (;;) {
			Signal<T> signal = source.poll(waker);
			if (signal == null) {
				break;
			}
			if (signal.isOnNext()) {
				if (buffer.isEmpty()) {
					deadline = timer.arm(Operators.addCap(timer.now(TimeUnit.NANOSECONDS), maxWaitNanos),
							TimeUnit.NANOSECONDS);
				}
				buffer.add(Objects.requireNonNull(signal.get(), "source produced a null element"));
				if (buffer.size() >= capacity) {
					return Signal.next(flush());
				}
				continue;
			}
			if (signal.isOnComplete()) {
				if (!buffer.isEmpty()) {
					return Signal.next(flush());
				}
				return terminate(Signal.complete());
			}
			return failed(ChunksException.inner(errorOf(signal)));
		}

		Deadline d = deadline;
		if (d == null) {
			if (!buffer.isEmpty()) {
				throw new IllegalStateException("no deadline but there are items");
			}
			return null;
		}

		Signal<Void> elapsed = d.poll(waker);
		if (elapsed == null) {
			if (LOGGER.isTraceEnabled()) {
				LOGGER.trace("Waiting with {} buffered elements", buffer.size());
			}
			return null;
		}
		if (elapsed.isOnError()) {
			return failed(ChunksException.timer(errorOf(elapsed)));
		}
		if (LOGGER.isDebugEnabled()) {
			LOGGER.debug("Deadline of {} elapsed with {} buffered elements", maxWait, buffer.size());
		}
		return Signal.next(flush());
	}

	/**
	 * Hand over whatever is currently buffered, possibly nothing, without polling the
	 * source. The pending deadline, if any, is cancelled.
	 *
	 * @return the buffered elements, in source order
	 */
	public List<T> drainRemaining() {
		return flush();
	}

	/**
	 * Acquire the source this adaptor is pulling from.
	 * <p>
	 * Care must be taken to avoid tampering with the state of the source, which may
	 * otherwise confuse this adaptor.
	 *
	 * @return the underlying source
	 */
	@SuppressWarnings("unchecked")
	public PollableSource<T> source() {
		return (PollableSource<T>) source.get();
	}

	/**
	 * Dispose this adaptor and return its source. The source itself is left untouched.
	 * <p>
	 * Elements buffered and not emitted yet are discarded, see {@link #drainRemaining()}.
	 *
	 * @return the underlying source
	 */
	public PollableSource<T> intoInner() {
		release();
		return source();
	}

	/**
	 * @return the maximum size of a batch
	 */
	public int capacity() {
		return capacity;
	}

	/**
	 * @return the maximum delay between the first element of a batch and its release
	 */
	public Duration maxWait() {
		return maxWait;
	}

	/**
	 * @return the number of elements buffered for the next batch
	 */
	public int buffered() {
		return buffer.size();
	}

	/**
	 * @return {@code true} if a deadline is pending for the current batch
	 */
	public boolean isArmed() {
		return deadline != null;
	}

	/**
	 * @return {@code true} if a failure was deferred behind the last batch and will be
	 * reported by the next poll
	 */
	public boolean isErrorPending() {
		return deferredError != null;
	}

	/**
	 * {@inheritDoc}
	 * <p>
	 * That is the case when an error is pending, when the adaptor is disposed, or when
	 * nothing is buffered and the source itself is drained.
	 */
	@Override
	public boolean isDrained() {
		return deferredError != null || disposed || (buffer.isEmpty() && source.isDrained());
	}

	/**
	 * Cancel the pending deadline and the source (when it is {@link Disposable}), and
	 * discard the buffered elements.
	 */
	@Override
	public void dispose() {
		if (release()) {
			source.dispose();
		}
	}

	@Override
	public boolean isDisposed() {
		return disposed;
	}

	@Override
	public String toString() {
		return "Chunks{capacity=" + capacity + ", maxWait=" + maxWait + ", buffered=" + buffer.size() + "}";
	}

	boolean release() {
		if (disposed) {
			return false;
		}
		disposed = true;
		List<T> dropped = flush();
		if (ownsTimer) {
			timer.dispose();
		}
		if (!dropped.isEmpty()) {
			LOGGER.debug("Discarding {} buffered elements", dropped.size());
			Consumer<? super T> hook = onDiscard;
			if (hook != null) {
				for (T t : dropped) {
					try {
						hook.accept(t);
					}
					catch (Throwable ex) {
						Exceptions.throwIfFatal(ex);
						LOGGER.warn("Error in discard hook", ex);
					}
				}
			}
		}
		return true;
	}

	Signal<List<T>> terminate(Signal<List<T>> signal) {
		if (ownsTimer && !timer.isDisposed()) {
			timer.dispose();
		}
		return signal;
	}

	Signal<List<T>> failed(ChunksException e) {
		if (buffer.isEmpty()) {
			return terminate(Signal.error(e));
		}
		if (LOGGER.isDebugEnabled()) {
			LOGGER.debug("Deferring {} after a batch of {} elements", e.kind(), buffer.size());
		}
		deferredError = e;
		return Signal.next(flush());
	}

	List<T> flush() {
		Deadline d = deadline;
		if (d != null) {
			deadline = null;
			d.dispose();
		}
		List<T> batch = buffer;
		buffer = new ArrayList<>(capacity);
		return batch;
	}

	static Throwable errorOf(Signal<?> signal) {
		Throwable t = signal.getThrowable();
		return t != null ? t : new IllegalStateException("error signal without a throwable");
	}

	static long saturatedNanos(Duration d) {
		try {
			return d.toNanos();
		}
		catch (ArithmeticException overflow) {
			return Long.MAX_VALUE;
		}
	}
}
