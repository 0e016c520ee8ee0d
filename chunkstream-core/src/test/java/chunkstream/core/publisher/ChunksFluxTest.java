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
import java.util.concurrent.CopyOnWriteArrayList;

import chunkstream.core.ChunksException;
import chunkstream.core.Sources;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import reactor.core.Scannable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;
import reactor.test.publisher.TestPublisher;
import reactor.test.scheduler.VirtualTimeScheduler;
import reactor.util.function.Tuple2;
import reactor.util.function.Tuples;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatIllegalArgumentException;

public class ChunksFluxTest {

	@AfterEach
	public void tearDown() {
		VirtualTimeScheduler.reset();
	}

	@Test
	public void messagesPassThrough() {
		StepVerifier.create(ChunksFlux.chunks(Flux.just(5), 5, Duration.ofSeconds(10)))
		            .assertNext(s -> assertThat(s).containsExactly(5))
		            .verifyComplete();
	}

	@Test
	public void messageChunks() {
		StepVerifier.create(ChunksFlux.chunks(Flux.range(0, 10), 5, Duration.ofSeconds(10)))
		            .assertNext(s -> assertThat(s).containsExactly(0, 1, 2, 3, 4))
		            .assertNext(s -> assertThat(s).containsExactly(5, 6, 7, 8, 9))
		            .verifyComplete();
	}

	@Test
	public void messageEarlyExit() {
		StepVerifier.create(ChunksFlux.chunks(Flux.just(1, 2, 3, 4), 5, Duration.ofSeconds(100)))
		            .assertNext(s -> assertThat(s).containsExactly(1, 2, 3, 4))
		            .verifyComplete();
	}

	@Test
	public void emptySourceCompletesWithoutBatch() {
		StepVerifier.create(ChunksFlux.chunks(Flux.<Integer>empty(), 5, Duration.ofSeconds(1)))
		            .verifyComplete();
	}

	Flux<List<Integer>> scenario_messageTimeout() {
		return ChunksFlux.chunks(Flux.concat(Flux.just(1, 2, 3, 4),
				Mono.just(5).delayElement(Duration.ofMillis(300)),
				Flux.just(6, 7, 8)), 5, Duration.ofMillis(100));
	}

	@Test
	public void messageTimeout() {
		StepVerifier.withVirtualTime(this::scenario_messageTimeout)
		            .expectSubscription()
		            .expectNoEvent(Duration.ofMillis(99))
		            .thenAwait(Duration.ofMillis(1))
		            .assertNext(s -> assertThat(s).containsExactly(1, 2, 3, 4))
		            .expectNoEvent(Duration.ofMillis(199))
		            .thenAwait(Duration.ofMillis(1))
		            .assertNext(s -> assertThat(s).containsExactly(5, 6, 7, 8))
		            .verifyComplete();
	}

	@Test
	public void messageTimeoutRealTime() {
		long start = System.nanoTime();
		List<Tuple2<Duration, List<Integer>>> timed =
				ChunksFlux.chunks(Flux.concat(Flux.just(1, 2, 3, 4),
						          Mono.just(5).delayElement(Duration.ofMillis(300)),
						          Flux.just(6, 7, 8)), 5, Duration.ofMillis(100))
				          .map(batch -> Tuples.of(Duration.ofNanos(System.nanoTime() - start), batch))
				          .collectList()
				          .block(Duration.ofSeconds(5));

		assertThat(timed).hasSize(2);
		assertThat(timed.get(0).getT2()).containsExactly(1, 2, 3, 4);
		assertThat(timed.get(0).getT1()).isBetween(Duration.ofMillis(80), Duration.ofMillis(280));
		assertThat(timed.get(1).getT2()).containsExactly(5, 6, 7, 8);
		assertThat(timed.get(1).getT1()).isBetween(Duration.ofMillis(150), Duration.ofMillis(350));
	}

	Flux<List<Integer>> scenario_accumulateOnSize() {
		return ChunksFlux.chunks(Flux.range(1, 6)
		                             .delayElements(Duration.ofMillis(300)), 5, Duration.ofMillis(2000));
	}

	@Test
	public void accumulateOnSize() {
		StepVerifier.withVirtualTime(this::scenario_accumulateOnSize)
		            .thenAwait(Duration.ofMillis(1500))
		            .assertNext(s -> assertThat(s).containsExactly(1, 2, 3, 4, 5))
		            .thenAwait(Duration.ofMillis(2000))
		            .assertNext(s -> assertThat(s).containsExactly(6))
		            .verifyComplete();
	}

	Flux<List<Integer>> scenario_accumulateOnTime() {
		return ChunksFlux.chunks(Flux.range(1, 6)
		                             .delayElements(Duration.ofMillis(300)), 15, Duration.ofMillis(1000));
	}

	@Test
	public void accumulateOnTimeAnchorsEachDeadlineOnItsFirstElement() {
		StepVerifier.withVirtualTime(this::scenario_accumulateOnTime)
		            .expectSubscription()
		            .expectNoEvent(Duration.ofMillis(1299))
		            .thenAwait(Duration.ofMillis(1))
		            .assertNext(s -> assertThat(s).containsExactly(1, 2, 3, 4))
		            .expectNoEvent(Duration.ofMillis(499))
		            .thenAwait(Duration.ofMillis(1))
		            .assertNext(s -> assertThat(s).containsExactly(5, 6))
		            .verifyComplete();
	}

	@Test
	public void errorIsDeliveredAfterBufferedBatch() {
		TestPublisher<Integer> source = TestPublisher.create();
		IllegalStateException boom = new IllegalStateException("boom");

		StepVerifier.withVirtualTime(() -> ChunksFlux.chunks(source, 3, Duration.ofSeconds(1)))
		            .expectSubscription()
		            .then(() -> source.next(1, 2))
		            .expectNoEvent(Duration.ofMillis(500))
		            .then(() -> source.next(3))
		            .assertNext(s -> assertThat(s).containsExactly(1, 2, 3))
		            .then(() -> source.next(4).error(boom))
		            .assertNext(s -> assertThat(s).containsExactly(4))
		            .expectErrorSatisfies(e -> assertThat(e)
				            .isInstanceOfSatisfying(ChunksException.class, ce -> assertThat(ce.isInner()).isTrue())
				            .hasCause(boom))
		            .verify();
	}

	@Test
	public void errorWithEmptyBufferIsImmediate() {
		StepVerifier.create(ChunksFlux.chunks(Flux.<Integer>error(new IllegalStateException("boom")),
				3, Duration.ofSeconds(1)))
		            .expectErrorSatisfies(e -> assertThat(ChunksException.unwrap(e)).hasMessage("boom"))
		            .verify();
	}

	@Test
	public void batchesWaitForDemand() {
		StepVerifier.create(ChunksFlux.chunks(Flux.range(1, 10), 3, Duration.ofSeconds(1)), 0)
		            .expectSubscription()
		            .expectNoEvent(Duration.ofMillis(50))
		            .thenRequest(1)
		            .assertNext(s -> assertThat(s).containsExactly(1, 2, 3))
		            .thenRequest(2)
		            .assertNext(s -> assertThat(s).containsExactly(4, 5, 6))
		            .assertNext(s -> assertThat(s).containsExactly(7, 8, 9))
		            .thenRequest(1)
		            .assertNext(s -> assertThat(s).containsExactly(10))
		            .verifyComplete();
	}

	@Test
	public void deferredErrorDoesNotWaitForDemand() {
		Flux<Integer> source = Flux.just(1, 2).concatWith(Flux.error(new IllegalStateException("boom")));

		StepVerifier.create(ChunksFlux.chunks(source, 5, Duration.ofSeconds(1)), 1)
		            .assertNext(s -> assertThat(s).containsExactly(1, 2))
		            .verifyErrorSatisfies(e -> assertThat(e).isInstanceOf(ChunksException.class)
		                                                    .hasMessageContaining("boom"));
	}

	@Test
	public void completionDoesNotWaitForDemand() {
		StepVerifier.create(ChunksFlux.chunks(Flux.range(1, 3), 3, Duration.ofSeconds(1)), 1)
		            .assertNext(s -> assertThat(s).containsExactly(1, 2, 3))
		            .verifyComplete();
	}

	@Test
	public void deadlineStartsOnceDemandResumes() {
		StepVerifier.withVirtualTime(() -> ChunksFlux.chunks(Flux.just(1, 2).concatWith(Flux.never()),
				5, Duration.ofMillis(100)), 0)
		            .expectSubscription()
		            .expectNoEvent(Duration.ofMillis(200))
		            .thenRequest(1)
		            .expectNoEvent(Duration.ofMillis(99))
		            .thenAwait(Duration.ofMillis(1))
		            .assertNext(s -> assertThat(s).containsExactly(1, 2))
		            .thenCancel()
		            .verify();
	}

	@Test
	public void cancelDiscardsBufferedElements() {
		List<Object> discarded = new CopyOnWriteArrayList<>();
		TestPublisher<Integer> source = TestPublisher.create();

		StepVerifier.create(ChunksFlux.chunks(source, 5, Duration.ofSeconds(10))
		                              .doOnDiscard(Integer.class, discarded::add))
		            .expectSubscription()
		            .then(() -> source.next(1, 2, 3))
		            .thenCancel()
		            .verify();

		source.assertCancelled();
		assertThat(discarded).containsExactly(1, 2, 3);
	}

	@Test
	public void fromSourceDrivesPollableSource() {
		StepVerifier.create(ChunksFlux.fromSource(() -> Sources.fromIterable(List.of(1, 2, 3, 4, 5)),
				2, Duration.ofSeconds(1), Schedulers.parallel()))
		            .assertNext(s -> assertThat(s).containsExactly(1, 2))
		            .assertNext(s -> assertThat(s).containsExactly(3, 4))
		            .assertNext(s -> assertThat(s).containsExactly(5))
		            .verifyComplete();
	}

	@Test
	public void fromSourceCompletesWhenDemandIsExactlyMet() {
		StepVerifier.create(ChunksFlux.fromSource(() -> Sources.fromIterable(List.of(1, 2, 3, 4)),
				2, Duration.ofSeconds(1), Schedulers.parallel()), 2)
		            .assertNext(s -> assertThat(s).containsExactly(1, 2))
		            .assertNext(s -> assertThat(s).containsExactly(3, 4))
		            .expectComplete()
		            .verify(Duration.ofSeconds(2));
	}

	@Test
	public void fromSourceFailsWithoutDemand() {
		StepVerifier.create(ChunksFlux.fromSource(() -> Sources.<Integer>error(new IllegalStateException("boom")),
				2, Duration.ofSeconds(1), Schedulers.parallel()), 0)
		            .expectSubscription()
		            .expectErrorSatisfies(e -> assertThat(e).isInstanceOf(ChunksException.class)
		                                                    .hasMessageContaining("boom"))
		            .verify(Duration.ofSeconds(2));
	}

	@Test
	public void fromSourceSupplierFailure() {
		StepVerifier.create(ChunksFlux.fromSource(() -> {
			throw new IllegalStateException("boom");
		}, 2, Duration.ofSeconds(1), Schedulers.parallel()))
		            .verifyErrorMessage("boom");
	}

	@Test
	public void invalidParameters() {
		assertThatIllegalArgumentException()
				.isThrownBy(() -> ChunksFlux.chunks(Flux.just(1), 0, Duration.ofSeconds(1)))
				.withMessage("maxSize must be strictly positive");
		assertThatIllegalArgumentException()
				.isThrownBy(() -> ChunksFlux.chunks(Flux.just(1), 1, Duration.ofSeconds(-1)));
		assertThatIllegalArgumentException()
				.isThrownBy(() -> ChunksFlux.chunks(Flux.just(1), 1, Duration.ofSeconds(1), Schedulers.parallel(), 0));
	}

	@Test
	public void scanOperator() {
		Flux<List<Integer>> flux = ChunksFlux.chunks(Flux.just(1), 3, Duration.ofSeconds(1));

		assertThat(flux).isInstanceOf(Scannable.class);
		assertThat(Scannable.from(flux).scan(Scannable.Attr.RUN_ON)).isSameAs(Schedulers.parallel());
		assertThat(Scannable.from(flux).scan(Scannable.Attr.RUN_STYLE)).isSameAs(Scannable.Attr.RunStyle.ASYNC);
		assertThat(Scannable.from(flux).scan(Scannable.Attr.CAPACITY)).isEqualTo(3);
	}
}
