package org.springaicommunity.github.harvester;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Shared rate state of one GitHub credential.
 *
 * <p>
 * One instance is passed by reference to every worker. Mutation goes through
 * {@link #observe(RateLimitInfo)} and {@link #acquire()}, both serialized by a single
 * lock; {@link #remaining()} is a lock-free read of the last published value.
 *
 * <p>
 * Invariant: {@code remaining >= 0}. While it is 0, {@link #acquire()} does not return
 * before the reset time has passed, unless a later response reports fresh quota. Until
 * the first response has been observed the governor lets every request through.
 */
public class RateGovernor {

	private static final Logger logger = LoggerFactory.getLogger(RateGovernor.class);

	private final ReentrantLock lock = new ReentrantLock();

	private final Condition quotaAvailable = lock.newCondition();

	private final Clock clock;

	private final Duration warnThreshold;

	private final long resetBufferMs;

	private volatile int remaining;

	private int limit;

	private long resetEpochSeconds;

	private boolean observed;

	public RateGovernor() {
		this(Clock.systemUTC(), Duration.ofMinutes(5), 1000);
	}

	/**
	 * @param clock source of the current time
	 * @param warnThreshold waits longer than this are logged at WARN
	 * @param resetBufferMs extra time to wait past the reported reset second
	 */
	public RateGovernor(Clock clock, Duration warnThreshold, long resetBufferMs) {
		this.clock = clock;
		this.warnThreshold = warnThreshold;
		this.resetBufferMs = Math.max(resetBufferMs, 0);
	}

	/**
	 * Update the rate state from response headers. A report for a later window replaces
	 * the state; a report for the current window can only lower the remaining count,
	 * since responses of concurrent requests arrive out of order. Reports of an older
	 * window are ignored.
	 * @param info rate limit headers of a response, may be null
	 */
	public void observe(@Nullable RateLimitInfo info) {
		if (info == null || !info.isKnown()) {
			return;
		}
		lock.lock();
		try {
			int reported = Math.max(info.remaining(), 0);
			if (!observed || info.reset() > resetEpochSeconds) {
				remaining = reported;
				resetEpochSeconds = info.reset();
				limit = info.limit();
			}
			else if (info.reset() == resetEpochSeconds) {
				remaining = Math.min(remaining, reported);
				if (info.limit() > 0) {
					limit = info.limit();
				}
			}
			observed = true;
			if (remaining > 0) {
				quotaAvailable.signalAll();
			}
		}
		finally {
			lock.unlock();
		}
	}

	/**
	 * Block until a request may be issued, then take one unit of quota. The decrement is
	 * optimistic and corrected by the next {@link #observe(RateLimitInfo)}.
	 * @throws IllegalStateException if the calling thread is interrupted while waiting
	 */
	public void acquire() {
		lock.lock();
		try {
			boolean warned = false;
			while (observed && remaining == 0) {
				long waitMs = resetEpochSeconds * 1000 + resetBufferMs - clock.millis();
				if (waitMs <= 0) {
					remaining = limit > 0 ? limit : 1;
					logger.info("Rate limit window reset, assuming {} requests available", remaining);
					break;
				}
				if (!warned) {
					if (waitMs > warnThreshold.toMillis()) {
						logger.warn("Rate limit exhausted. Waiting {} seconds until reset at epoch {}",
								TimeUnit.MILLISECONDS.toSeconds(waitMs), resetEpochSeconds);
					}
					else {
						logger.info("Rate limit exhausted. Waiting {}ms until reset at epoch {}", waitMs,
								resetEpochSeconds);
					}
					warned = true;
				}
				quotaAvailable.await(waitMs, TimeUnit.MILLISECONDS);
			}
			if (observed) {
				remaining = remaining - 1;
			}
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new IllegalStateException("Interrupted while waiting for rate limit reset", e);
		}
		finally {
			lock.unlock();
		}
	}

	/**
	 * Returns the last published remaining count without blocking.
	 * @return remaining requests, or 0 before anything was observed
	 */
	public int remaining() {
		return remaining;
	}

	/**
	 * Returns a consistent copy of the current rate state.
	 * @return the state, or null before the first observation
	 */
	public @Nullable RateLimitInfo snapshot() {
		lock.lock();
		try {
			if (!observed) {
				return null;
			}
			return new RateLimitInfo(limit, remaining, resetEpochSeconds, limit > 0 ? limit - remaining : -1);
		}
		finally {
			lock.unlock();
		}
	}

}
