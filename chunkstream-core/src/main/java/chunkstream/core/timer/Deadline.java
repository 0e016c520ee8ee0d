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

import chunkstream.core.Waker;
import org.jspecify.annotations.Nullable;
import reactor.core.Disposable;
import reactor.core.publisher.Signal;

/**
 * A single-shot wait armed for an absolute instant by a {@link DeadlineTimer}.
 * <p>
 * {@link #dispose() Disposing} a deadline cancels it: it will then never wake the
 * {@link Waker} it was last polled with.
 */
public interface Deadline extends Disposable {

	/**
	 * Check whether this deadline has elapsed.
	 *
	 * @param waker the {@link Waker} to notify once the deadline elapses, if it has not yet
	 * @return {@link Signal#complete()} once elapsed, {@link Signal#error(Throwable)} if
	 * the timer failed, or {@code null} if the deadline is still ahead
	 */
	@Nullable
	Signal<Void> poll(Waker waker);
}
