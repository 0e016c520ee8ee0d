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

/**
 * A handle given to {@link PollableSource#poll(Waker)} so that a source which is not
 * ready yet can notify its driver once it becomes ready.
 * <p>
 * Unlike {@link PollableSource#poll(Waker)}, {@link #wake()} may be invoked from any
 * thread and any number of times. A spurious wake is allowed and only costs the driver
 * one extra poll.
 */
@FunctionalInterface
public interface Waker {

	/**
	 * A {@link Waker} that ignores notifications, for sources that are polled in a loop
	 * or are always ready.
	 */
	Waker NOOP = () -> { };

	/**
	 * Notify the driver that the source which received this waker may now make progress.
	 */
	void wake();
}
