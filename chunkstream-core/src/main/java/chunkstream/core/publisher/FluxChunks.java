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
import java.util.concurrent.atomic.AtomicIntegerFieldUpdater;
import java.util.concurrent.atomic.AtomicLongFieldUpdater;
import java.util.function.Function;

import chunkstream.core.Chunks;
import chunkstream.core.PollableSource;
import chunkstream.core.Waker;
import chunkstream.core.timer.DeadlineTimer;
import chunkstream.core.timer.SchedulerDeadlineTimer;
import org.jspecify.annotations.Nullable;
import org.reactivestreams.Subscription;
import reactor.core.CoreSubscriber;
import reactor.core.Disposable;
import reactor.core.Exceptions;
import reactor.core.Scannable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Operators;
import reactor.core.publisher.Signal;
import reactor.core.scheduler.Scheduler;
import reactor.util.Logger;
import reactor.util.Loggers;
import reactor.util.context.Context;

/**
 * Drives a {@link Chunks} adaptor on behalf of a {@link CoreSubscriber}: the adaptor is
 * polled in a serialized drain loop as long as there is downstream demand, and the
 * {@link Waker} handed to the adaptor re-enters that loop whenever the source or the
 * current deadline becomes ready. Without demand it is only polled when
 * {@link Chunks#isDrained() drained}, so that termination is not held back.
 *
 * @param <T> the type of the batched elements
 */
final class FluxChunks<T> extends Flux<List<T>> implements Scannable {

	static final Logger LOGGER = Loggers.getLogger(FluxChunks.class);

	final Function<Context, ? extends PollableSource<? extends T>> sourceFactory;
	final int                                                      batchSize;
	final Duration                                                 maxWait;
	final Scheduler                                                timer;

	FluxChunks(Function<Context, ? extends PollableSource<? extends T>> sourceFactory,
			int batchSize,
			Duration maxWait,
			Scheduler timer) {
		if (batchSize <= 0) {
			throw new IllegalArgumentException("maxSize must be strictly positive");
		}
		this.sourceFactory = Objects.requireNonNull(sourceFactory, "sourceFactory");
		this.batchSize = batchSize;
		this.maxWait = Objects.requireNonNull(maxWait, "maxWait");
		if (maxWait.isNegative()) {
			throw new IllegalArgumentException("maxWait must not be negative");
		}
		this.timer = Objects.requireNonNull(timer, "timer");
	}

	@Override
	public void subscribe(CoreSubscriber<? super List<T>> actual) {
		Context ctx = actual.currentContext();
		PollableSource<? extends T> source = null;
		DeadlineTimer deadlineTimer = null;
		Chunks<T> chunks;
		try {
			source = Objects.requireNonNull(sourceFactory.apply(ctx),
					"The sourceFactory returned a null source");
			deadlineTimer = SchedulerDeadlineTimer.create(timer);
			chunks = Chunks.create(source,
					batchSize,
					maxWait,
					deadlineTimer,
					t -> Operators.onDiscard(t, ctx));
		}
		catch (Throwable e) {
			Exceptions.throwIfFatal(e);
			if (source instanceof Disposable) {
				((Disposable) source).dispose();
			}
			if (deadlineTimer != null) {
				deadlineTimer.dispose();
			}
			Operators.error(actual, Operators.onOperatorError(e, ctx));
			return;
		}
		ChunksSubscription<T> subscription = new ChunksSubscription<>(actual, chunks, deadlineTimer);
		actual.onSubscribe(subscription);
		subscription.drain();
	}

	@Override
	public @Nullable Object scanUnsafe(Attr key) {
		if (key == Attr.RUN_ON) return timer;
		if (key == Attr.RUN_STYLE) return Attr.RunStyle.ASYNC;
		if (key == Attr.CAPACITY) return batchSize;

		return null;
	}

	static final class ChunksSubscription<T> implements Subscription, Waker, Scannable {

		final CoreSubscriber<? super List<T>> actual;
		final Chunks<T>                       chunks;
		final DeadlineTimer                   timer;

		boolean done;

		volatile boolean cancelled;

		volatile long requested;
		@SuppressWarnings("rawtypes")
		static final AtomicLongFieldUpdater<ChunksSubscription> REQUESTED =
				AtomicLongFieldUpdater.newUpdater(ChunksSubscription.class, "requested");

		volatile int wip;
		@SuppressWarnings("rawtypes")
		static final AtomicIntegerFieldUpdater<ChunksSubscription> WIP =
				AtomicIntegerFieldUpdater.newUpdater(ChunksSubscription.class, "wip");

		ChunksSubscription(CoreSubscriber<? super List<T>> actual,
				Chunks<T> chunks,
				DeadlineTimer timer) {
			this.actual = actual;
			this.chunks = chunks;
			this.timer = timer;
		}

		@Override
		public void request(long n) {
			if (Operators.validate(n)) {
				Operators.addCap(REQUESTED, this, n);
				drain();
			}
		}

		@Override
		public void cancel() {
			if (cancelled) {
				return;
			}
			cancelled = true;
			drain();
		}

		@Override
		public void wake() {
			drain();
		}

		void drain() {
			if (WIP.getAndIncrement(this) != 0) {
				return;
			}
			int missed = 1;
			for (;;) {
				if (done) {
					return;
				}
				long r = requested;
				long e = 0L;

				for (;;) {
					if (cancelled) {
						done = true;
						if (LOGGER.isDebugEnabled() && chunks.buffered() > 0) {
							LOGGER.debug("Cancelled with {} buffered elements", chunks.buffered());
						}
						chunks.dispose();
						timer.dispose();
						return;
					}
					if (e == r && !chunks.isDrained()) {
						break;
					}

					Signal<List<T>> signal;
					try {
						signal = chunks.poll(this);
					}
					catch (Throwable ex) {
						Exceptions.throwIfFatal(ex);
						terminate(Signal.error(Operators.onOperatorError(ex, actual.currentContext())));
						return;
					}

					if (signal == null) {
						break;
					}
					if (signal.isOnNext()) {
						List<T> batch = signal.get();
						if (batch != null) {
							actual.onNext(batch);
							e++;
						}
						continue;
					}
					terminate(signal);
					return;
				}

				if (e != 0L && r != Long.MAX_VALUE) {
					REQUESTED.addAndGet(this, -e);
				}

				missed = WIP.addAndGet(this, -missed);
				if (missed == 0) {
					break;
				}
			}
		}

		void terminate(Signal<List<T>> signal) {
			done = true;
			chunks.dispose();
			timer.dispose();
			Throwable e = signal.getThrowable();
			if (e != null) {
				actual.onError(e);
			}
			else {
				actual.onComplete();
			}
		}

		@Override
		public @Nullable Object scanUnsafe(Attr key) {
			if (key == Attr.ACTUAL) return actual;
			if (key == Attr.CANCELLED) return cancelled;
			if (key == Attr.TERMINATED) return done && !cancelled;
			if (key == Attr.REQUESTED_FROM_DOWNSTREAM) return requested;
			if (key == Attr.CAPACITY) return chunks.capacity();
			if (key == Attr.BUFFERED) return chunks.buffered();
			if (key == Attr.RUN_STYLE) return Attr.RunStyle.ASYNC;

			return null;
		}
	}
}
