package dev.cpputest.adapter.process;

import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Cooperative cancellation flag shared by every blocking operation of a run.
 * <p>
 * Once cancelled, a signal stays cancelled. {@link #close()} should only be called after both the
 * threads watching for cancellation and the threads that might cancel are done with it.
 */
public final class CancelSignal implements AutoCloseable {
	private static final Logger log = LoggerFactory.getLogger(CancelSignal.class);

	private static final long POLL_INTERVAL_MILLIS = 1;

	private final ReentrantLock lock = new ReentrantLock();
	private volatile boolean cancelled = false;
	private volatile boolean closed = false;
	private @Nullable TimeoutMonitor monitor;

	public boolean isCancellationRequested() {
		return cancelled;
	}

	public void cancel() {
		checkNotClosed();
		cancelled = true;
	}

	/**
	 * @throws CancellationException if cancellation has been requested.
	 */
	public void throwIfCancellationRequested() {
		if(cancelled) {
			throw new CancellationException("Operation was cancelled");
		}
	}

	/**
	 * Arranges for this signal to be cancelled once the timeout elapses.
	 * A timeout armed by an earlier call is stopped first.
	 *
	 * @return this signal, so it can be armed right after construction.
	 */
	public CancelSignal cancelAfterTimeout(Duration timeout) {
		lock.lock();
		try {
			checkNotClosed();
			stopMonitor();

			var newMonitor = new TimeoutMonitor(timeout);
			monitor = newMonitor;
			newMonitor.thread.start();
		}
		finally {
			lock.unlock();
		}
		return this;
	}

	public CancelSignal cancelAfterTimeout(long timeoutMillis) {
		return cancelAfterTimeout(Duration.ofMillis(timeoutMillis));
	}

	@Override
	public void close() {
		lock.lock();
		try {
			closed = true;
			stopMonitor();
		}
		finally {
			lock.unlock();
		}
	}

	private void checkNotClosed() {
		if(closed) {
			throw new IllegalStateException("CancelSignal has already been closed");
		}
	}

	private void stopMonitor() {
		var current = monitor;
		if(current == null) {
			return;
		}

		current.stopRequested = true;
		joinUninterruptibly(current.thread);
		monitor = null;
	}

	// The monitor exits within one poll interval of being stopped, so waiting for it is bounded.
	private static void joinUninterruptibly(Thread thread) {
		boolean interrupted = false;
		try {
			while(true) {
				try {
					thread.join();
					return;
				}
				catch(InterruptedException e) {
					interrupted = true;
				}
			}
		}
		finally {
			if(interrupted) {
				Thread.currentThread().interrupt();
			}
		}
	}

	@Override
	public String toString() {
		return "CancelSignal{cancelled=" + cancelled + ", closed=" + closed + "}";
	}

	private final class TimeoutMonitor implements Runnable {
		TimeoutMonitor(Duration timeout) {
			this.timeoutNanos = timeout.toNanos();
			this.thread = new Thread(this, "cancel-signal-timeout");
			this.thread.setDaemon(true);
		}

		private final long timeoutNanos;
		private final Thread thread;
		private volatile boolean stopRequested = false;

		@Override
		public void run() {
			long start = System.nanoTime();
			while(System.nanoTime() - start < timeoutNanos && !cancelled && !stopRequested) {
				try {
					Thread.sleep(POLL_INTERVAL_MILLIS);
				}
				catch(InterruptedException e) {
					log.debug("Timeout monitor interrupted, leaving signal untouched");
					return;
				}
			}

			if(!stopRequested && !cancelled) {
				log.debug("Timeout of {} ms elapsed, cancelling", Duration.ofNanos(timeoutNanos).toMillis());
				cancelled = true;
			}
		}
	}
}
