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

import java.util.concurrent.TimeUnit;

import reactor.core.Disposable;

/**
 * A clock and a factory of single-shot {@link Deadline deadlines} on that clock.
 * Arming a deadline is expected to be cheap, as one is armed per batch.
 * <p>
 * Disposing the timer cancels every deadline it armed and still pending. A timer may be
 * shared by several adaptors: whoever created it is responsible for disposing it.
 */
public interface DeadlineTimer extends Disposable {

	/**
	 * Returns the current instant of this timer's clock.
	 *
	 * @param unit the target {@link TimeUnit}
	 * @return the current instant in the given unit
	 */
	long now(TimeUnit unit);

	/**
	 * Arm a new {@link Deadline} elapsing at the given absolute instant of this timer's
	 * clock. An instant in the past yields a deadline that elapses as soon as possible.
	 * <p>
	 * Failures to schedule are never thrown, they are reported by
	 * {@link Deadline#poll(chunkstream.core.Waker)}.
	 *
	 * @param deadline the instant, as reported by {@link #now(TimeUnit)}
	 * @param unit the {@link TimeUnit} of {@code deadline}
	 * @return the armed {@link Deadline}
	 */
	Deadline arm(long deadline, TimeUnit unit);
}
