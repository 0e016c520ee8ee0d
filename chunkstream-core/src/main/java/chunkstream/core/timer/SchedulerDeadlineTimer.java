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

package chunkstream.core.timer;

import java.util.Objects;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicIntegerFieldUpdater;
import java.util.concurrent.atomic.AtomicReferenceFieldUpdater;

import chunkstream.core.Waker;
import org.jspecify.annotations.Nullable;
import reactor.core.Disposable;
import reactor.core.Disposables;
import reactor.core.publisher.Signal;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;
import reactor.util.Logger;
import reactor.util.Loggers;

/**
 * A {@link DeadlineTimer} backed by a {@link Scheduler.Worker}. The clock is the
 * {@link Scheduler#now(TimeUnit) clock of the scheduler}, so that a
 * {@code VirtualTimeScheduler} drives deadlines in tests.
 */
public final class SchedulerDeadlineTimer implements DeadlineTimer {

	static final Logger LOGGER = Loggers.getLogger(SchedulerDeadlineTimer.class);

	/**
	 * Create a {@link SchedulerDeadlineTimer} on {@link Schedulers#parallel()}.
	 *
	 * @return a new {@link SchedulerDeadlineTimer}
	 */
	public static SchedulerDeadlineTimer create() {
		return create(Schedulers.parallel());
	}

	/**
	 * Create a {@link SchedulerDeadlineTimer} on the given {@link Scheduler}.
	 *
	 * @param scheduler the {@link Scheduler} running the deadline tasks
	 * @return a new {@link SchedulerDeadlineTimer}
	 */
	public static SchedulerDeadlineTimer create(Scheduler scheduler) {
		return new SchedulerDeadlineTimer(scheduler);
	}

	final Scheduler        scheduler;
	final Scheduler.Worker worker;

	SchedulerDeadlineTimer(Scheduler scheduler) {
		this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
		this.worker = scheduler.createWorker();
	}

	@Override
	public long now(TimeUnit unit) {
		return scheduler.now(unit);
	}

	@Override
	public Deadline arm(long deadline, TimeUnit unit) {
		long delay = unit.toNanos(deadline) - scheduler.now(TimeUnit.NANOSECONDS);
		SchedulerDeadline d = new SchedulerDeadline();
		try {
			d.task.update(worker.schedule(d, Math.max(0L, delay), TimeUnit.NANOSECONDS));
		}
		catch (RejectedExecutionException ree) {
			LOGGER.debug("Deadline rejected by {}", scheduler);
			d.error = ree;
		}
		return d;
	}

	/**
	 * @return the {@link Scheduler} running the deadline tasks
	 */
	public Scheduler scheduler() {
		return scheduler;
	}

	@Override
	public void dispose() {
		worker.dispose();
	}

	@Override
	public boolean isDisposed() {
		return worker.isDisposed();
	}

	@Override
	public String toString() {
		return "SchedulerDeadlineTimer{" + scheduler + "}";
	}

	static final class SchedulerDeadline implements Deadline, Runnable {

		static final int PENDING  = 0;
		static final int ELAPSED  = 1;
		static final int DISPOSED = 2;

		final Disposable.Swap task = Disposables.swap();

		@Nullable Throwable error;

		volatile int state;
		static final AtomicIntegerFieldUpdater<SchedulerDeadline> STATE =
				AtomicIntegerFieldUpdater.newUpdater(SchedulerDeadline.class, "state");

		volatile @Nullable Waker waker;
		static final AtomicReferenceFieldUpdater<SchedulerDeadline, Waker> WAKER =
				AtomicReferenceFieldUpdater.newUpdater(SchedulerDeadline.class, Waker.class, "waker");

		@Override
		public void run() {
			if (STATE.compareAndSet(this, PENDING, ELAPSED)) {
				Waker w = WAKER.getAndSet(this, null);
				if (w != null) {
					w.wake();
				}
			}
		}

		@Override
		public @Nullable Signal<Void> poll(Waker waker) {
			Throwable e = error;
			if (e != null) {
				return Signal.error(e);
			}
			if (state == ELAPSED) {
				return Signal.complete();
			}
			WAKER.set(this, waker);
			// the task may have run between the state check and the registration
			if (state == ELAPSED) {
				WAKER.lazySet(this, null);
				return Signal.complete();
			}
			return null;
		}

		@Override
		public void dispose() {
			if (STATE.getAndSet(this, DISPOSED) != DISPOSED) {
				WAKER.lazySet(this, null);
				task.dispose();
			}
		}

		@Override
		public boolean isDisposed() {
			return state == DISPOSED;
		}
	}
}
