package dev.cpputest.adapter.host;

public enum MessageLevel {
	INFORMATIONAL,
	WARNING,
	ERROR,
}
