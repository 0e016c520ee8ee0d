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

import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.atomic.AtomicReferenceFieldUpdater;

import chunkstream.core.PollableSource;
import chunkstream.core.Waker;
import org.jspecify.annotations.Nullable;
import org.reactivestreams.Publisher;
import org.reactivestreams.Subscription;
import reactor.core.CoreSubscriber;
import reactor.core.Disposable;
import reactor.core.Exceptions;
import reactor.core.Scannable;
import reactor.core.publisher.Operators;
import reactor.core.publisher.Signal;
import reactor.util.concurrent.Queues;
import reactor.util.context.Context;

/**
 * Bridges a Reactive Streams {@link Publisher} into a {@link PollableSource}.
 * <p>
 * Up to {@code prefetch} elements are requested upfront and queued, and the demand is
 * replenished once 75% of them have been polled. The {@link Waker} passed to the last
 * unsuccessful {@link #poll(Waker)} is woken by the next upstream signal.
 *
 * @param <T> the type of the produced elements
 */
public final class PublisherSource<T> implements PollableSource<T>, CoreSubscriber<T>,
                                                 Disposable, Scannable {

	/**
	 * The default prefetch, set by the {@code chunkstream.prefetch} system property and
	 * defaulting to 256, with a minimum of 16.
	 */
	public static final int DEFAULT_PREFETCH = Math.max(16,
			Integer.parseInt(System.getProperty("chunkstream.prefetch", "256")));

	/**
	 * Subscribe to the given {@link Publisher} with the {@link #DEFAULT_PREFETCH} and
	 * return the {@link PublisherSource} receiving its signals.
	 *
	 * @param publisher the {@link Publisher} to bridge
	 * @param <T> the type of the produced elements
	 * @return a new subscribed {@link PublisherSource}
	 */
	public static <T> PublisherSource<T> subscribe(Publisher<? extends T> publisher) {
		return subscribe(publisher, DEFAULT_PREFETCH, Context.empty());
	}

	/**
	 * Subscribe to the given {@link Publisher} and return the {@link PublisherSource}
	 * receiving its signals.
	 *
	 * @param publisher the {@link Publisher} to bridge
	 * @param prefetch the number of elements to request upfront
	 * @param context the {@link Context} exposed to the upstream
	 * @param <T> the type of the produced elements
	 * @return a new subscribed {@link PublisherSource}
	 */
	public static <T> PublisherSource<T> subscribe(Publisher<? extends T> publisher,
			int prefetch,
			Context context) {
		Objects.requireNonNull(publisher, "publisher");
		PublisherSource<T> source = new PublisherSource<>(prefetch, context);
		publisher.subscribe(source);
		return source;
	}

	final int      prefetch;
	final int      limit;
	final Queue<T> queue;
	final Context  context;

	volatile @Nullable Subscription s;
	@SuppressWarnings("rawtypes")
	static final AtomicReferenceFieldUpdater<PublisherSource, Subscription> S =
			AtomicReferenceFieldUpdater.newUpdater(PublisherSource.class, Subscription.class, "s");

	volatile @Nullable Waker waker;
	@SuppressWarnings("rawtypes")
	static final AtomicReferenceFieldUpdater<PublisherSource, Waker> WAKER =
			AtomicReferenceFieldUpdater.newUpdater(PublisherSource.class, Waker.class, "waker");

	volatile boolean done;
	@Nullable Throwable error;

	volatile boolean cancelled;

	int produced;

	PublisherSource(int prefetch, Context context) {
		if (prefetch <= 0) {
			throw new IllegalArgumentException("prefetch must be strictly positive, was " + prefetch);
		}
		this.prefetch = prefetch;
		this.limit = prefetch == Integer.MAX_VALUE ? Integer.MAX_VALUE : prefetch - (prefetch >> 2);
		this.queue = Queues.<T>get(prefetch).get();
		this.context = Objects.requireNonNull(context, "context");
	}

	@Override
	public Context currentContext() {
		return context;
	}

	@Override
	public void onSubscribe(Subscription s) {
		if (Operators.setOnce(S, this, s)) {
			s.request(prefetch == Integer.MAX_VALUE ? Long.MAX_VALUE : prefetch);
		}
	}

	@Override
	public void onNext(T t) {
		if (done) {
			Operators.onNextDropped(t, context);
			return;
		}
		if (cancelled) {
			Operators.onDiscard(t, context);
			return;
		}
		if (!queue.offer(t)) {
			error = Operators.onOperatorError(s,
					Exceptions.failWithOverflow(Exceptions.BACKPRESSURE_ERROR_QUEUE_FULL),
					t,
					context);
			Operators.onDiscard(t, context);
			done = true;
		}
		signal();
	}

	@Override
	public void onError(Throwable t) {
		if (done) {
			Operators.onErrorDropped(t, context);
			return;
		}
		error = t;
		done = true;
		signal();
	}

	@Override
	public void onComplete() {
		if (done) {
			return;
		}
		done = true;
		signal();
	}

	@Override
	public @Nullable Signal<T> poll(Waker waker) {
		for (;;) {
			boolean d = done;
			T t = queue.poll();
			if (t != null) {
				if (limit != Integer.MAX_VALUE && ++produced == limit) {
					produced = 0;
					Subscription a = s;
					if (a != null) {
						a.request(limit);
					}
				}
				return Signal.next(t);
			}
			if (d) {
				Throwable e = error;
				return e != null ? Signal.error(e) : Signal.complete();
			}
			if (this.waker == waker) {
				return null;
			}
			// re-check after registering, a signal may have raced the registration
			WAKER.set(this, waker);
		}
	}

	/**
	 * @return {@code true} if the upstream terminated and every queued element was polled
	 */
	@Override
	public boolean isDrained() {
		return done && queue.isEmpty();
	}

	@Override
	public void dispose() {
		if (cancelled) {
			return;
		}
		cancelled = true;
		Operators.terminate(S, this);
		WAKER.lazySet(this, null);
		Operators.onDiscardQueueWithClear(queue, context, null);
	}

	@Override
	public boolean isDisposed() {
		return cancelled;
	}

	@Override
	public @Nullable Object scanUnsafe(Attr key) {
		if (key == Attr.PARENT) return s;
		if (key == Attr.PREFETCH) return prefetch;
		if (key == Attr.BUFFERED) return queue.size();
		if (key == Attr.TERMINATED) return done;
		if (key == Attr.CANCELLED) return cancelled;
		if (key == Attr.ERROR) return error;
		if (key == Attr.RUN_STYLE) return Attr.RunStyle.SYNC;

		return null;
	}

	void signal() {
		Waker w = WAKER.getAndSet(this, null);
		if (w != null) {
			w.wake();
		}
	}
}
