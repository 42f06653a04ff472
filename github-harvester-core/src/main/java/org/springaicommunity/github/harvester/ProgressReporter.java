package org.springaicommunity.github.harvester;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Best-effort, non-blocking progress channel.
 *
 * <p>
 * Updates go into a bounded queue drained by a single daemon dispatcher thread that
 * calls the {@link ProgressListener}. {@link #publish(HarvestProgress)} never blocks:
 * when the queue is full the oldest pending update is dropped, so a slow listener never
 * slows the crawl down. On {@link #close()} the updates still queued are delivered before
 * the dispatcher stops.
 */
public class ProgressReporter implements AutoCloseable {

	private static final Logger logger = LoggerFactory.getLogger(ProgressReporter.class);

	private static final ProgressReporter DISABLED = new ProgressReporter();

	private final @Nullable ProgressListener listener;

	private final @Nullable BlockingQueue<HarvestProgress> queue;

	private final @Nullable Thread dispatcher;

	private final AtomicLong dropped = new AtomicLong();

	private volatile boolean closed;

	private ProgressReporter() {
		this.listener = null;
		this.queue = null;
		this.dispatcher = null;
	}

	public ProgressReporter(ProgressListener listener, int capacity) {
		if (capacity < 1) {
			throw new IllegalArgumentException("Progress queue capacity must be positive");
		}
		this.listener = listener;
		this.queue = new ArrayBlockingQueue<>(capacity);
		this.dispatcher = new Thread(this::dispatch, "harvest-progress");
		this.dispatcher.setDaemon(true);
		this.dispatcher.start();
	}

	/**
	 * Returns a reporter that discards every update.
	 * @return the shared disabled reporter
	 */
	public static ProgressReporter disabled() {
		return DISABLED;
	}

	/**
	 * Enqueue an update without blocking, dropping the oldest pending one if needed.
	 * @param progress the update
	 */
	public void publish(HarvestProgress progress) {
		if (queue == null || closed) {
			return;
		}
		while (!queue.offer(progress)) {
			if (queue.poll() != null) {
				dropped.incrementAndGet();
			}
		}
	}

	/**
	 * Returns how many updates were dropped because the listener lagged behind.
	 * @return dropped update count
	 */
	public long droppedUpdates() {
		return dropped.get();
	}

	private void dispatch() {
		while (!closed || !queue.isEmpty()) {
			HarvestProgress next;
			try {
				next = queue.poll(50, TimeUnit.MILLISECONDS);
			}
			catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				return;
			}
			if (next != null) {
				try {
					listener.onProgress(next);
				}
				catch (RuntimeException e) {
					logger.warn("Progress listener failed: {}", e.getMessage());
				}
			}
		}
	}

	@Override
	public void close() {
		if (dispatcher == null || closed) {
			return;
		}
		closed = true;
		try {
			dispatcher.join(TimeUnit.SECONDS.toMillis(2));
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
		}
		if (dropped.get() > 0) {
			logger.debug("Progress channel dropped {} updates", dropped.get());
		}
	}

}
