package org.springaicommunity.github.harvester;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for {@link RateGovernor}.
 */
@DisplayName("RateGovernor Tests")
class RateGovernorTest {

	private final RateGovernor governor = new RateGovernor(Clock.systemUTC(), Duration.ofMinutes(5), 0);

	private static long nowSeconds() {
		return System.currentTimeMillis() / 1000;
	}

	@Nested
	@DisplayName("Observation Tests")
	class ObservationTest {

		@Test
		@DisplayName("Should be permissive before anything was observed")
		void shouldBePermissiveBeforeFirstObservation() {
			governor.acquire();
			governor.acquire();

			assertThat(governor.snapshot()).isNull();
			assertThat(governor.remaining()).isZero();
		}

		@Test
		@DisplayName("Should ignore responses without rate limit headers")
		void shouldIgnoreMissingHeaders() {
			governor.observe(null);
			governor.observe(new RateLimitInfo(-1, -1, -1, -1));

			assertThat(governor.snapshot()).isNull();
		}

		@Test
		@DisplayName("Should only lower remaining within the same window")
		void shouldOnlyLowerRemainingWithinWindow() {
			long reset = nowSeconds() + 3600;
			governor.observe(new RateLimitInfo(5000, 4000, reset, 1000));
			governor.observe(new RateLimitInfo(5000, 4500, reset, 500));

			assertThat(governor.remaining()).isEqualTo(4000);
		}

		@Test
		@DisplayName("Should replace state when a later window is reported")
		void shouldReplaceStateForLaterWindow() {
			long reset = nowSeconds() + 60;
			governor.observe(new RateLimitInfo(5000, 3, reset, 4997));
			governor.observe(new RateLimitInfo(5000, 4999, reset + 3600, 1));

			assertThat(governor.remaining()).isEqualTo(4999);
			assertThat(governor.snapshot().reset()).isEqualTo(reset + 3600);
		}

		@Test
		@DisplayName("Should ignore reports of an older window")
		void shouldIgnoreOlderWindow() {
			long reset = nowSeconds() + 3600;
			governor.observe(new RateLimitInfo(5000, 4999, reset, 1));
			governor.observe(new RateLimitInfo(5000, 2, reset - 3600, 4998));

			assertThat(governor.remaining()).isEqualTo(4999);
		}

		@Test
		@DisplayName("Should decrement remaining optimistically on acquire")
		void shouldDecrementOnAcquire() {
			governor.observe(new RateLimitInfo(5000, 10, nowSeconds() + 3600, 4990));

			governor.acquire();
			governor.acquire();

			assertThat(governor.remaining()).isEqualTo(8);
			assertThat(governor.snapshot().used()).isEqualTo(4992);
		}

	}

	@Nested
	@DisplayName("Exhaustion Tests")
	class ExhaustionTest {

		@Test
		@DisplayName("Should not return before reset while quota is exhausted")
		void shouldWaitUntilReset() {
			long reset = nowSeconds() + 2;
			governor.observe(new RateLimitInfo(5000, 0, reset, 5000));

			governor.acquire();

			assertThat(System.currentTimeMillis()).isGreaterThanOrEqualTo(reset * 1000);
			assertThat(governor.remaining()).isEqualTo(4999);
		}

		@Test
		@DisplayName("Should proceed immediately when the reset time already passed")
		void shouldProceedAfterReset() {
			governor.observe(new RateLimitInfo(60, 0, nowSeconds() - 5, 60));

			long start = System.nanoTime();
			governor.acquire();

			assertThat(Duration.ofNanos(System.nanoTime() - start)).isLessThan(Duration.ofSeconds(1));
			assertThat(governor.remaining()).isEqualTo(59);
		}

		@Test
		@DisplayName("Should wake waiting callers when fresh quota is observed")
		void shouldWakeWaitersOnFreshQuota() throws Exception {
			long reset = nowSeconds() + 600;
			governor.observe(new RateLimitInfo(5000, 0, reset, 5000));

			CompletableFuture<Void> waiter = CompletableFuture.runAsync(governor::acquire);
			Thread.sleep(200);
			assertThat(waiter).isNotDone();

			governor.observe(new RateLimitInfo(5000, 5000, reset + 3600, 0));

			waiter.get(5, TimeUnit.SECONDS);
			assertThat(governor.remaining()).isEqualTo(4999);
		}

		@Test
		@DisplayName("Should restore the interrupt flag when interrupted while waiting")
		void shouldPropagateInterrupt() throws Exception {
			governor.observe(new RateLimitInfo(5000, 0, nowSeconds() + 600, 5000));

			CompletableFuture<Throwable> outcome = new CompletableFuture<>();
			Thread waiter = new Thread(() -> {
				try {
					governor.acquire();
					outcome.complete(null);
				}
				catch (IllegalStateException e) {
					outcome.complete(Thread.currentThread().isInterrupted() ? e : null);
				}
			});
			waiter.start();
			Thread.sleep(200);
			waiter.interrupt();

			assertThat(outcome.get(5, TimeUnit.SECONDS)).isInstanceOf(IllegalStateException.class)
				.hasMessageContaining("Interrupted");
		}

	}

}
