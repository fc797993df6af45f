package dev.cpputest.adapter.host;

/**
 * Host-visible message channel. Implementations must tolerate concurrent calls.
 */
@FunctionalInterface
public interface MessageLogger {
	void sendMessage(MessageLevel level, String message);
}
