package dev.cpputest.adapter.report;

import java.io.IOException;

public class ReportFormatException extends IOException {
	public ReportFormatException(String message) {
		super(message);
	}
}
