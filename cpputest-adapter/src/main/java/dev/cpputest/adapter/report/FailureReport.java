package dev.cpputest.adapter.report;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public class FailureReport {

	@JacksonXmlProperty(isAttribute = true, localName = "message")
	private String message;

	@JacksonXmlProperty(isAttribute = true, localName = "type")
	private String type;

	public String getMessage() {
		return message;
	}

	public void setMessage(String message) {
		this.message = message;
	}

	public String getType() {
		return type;
	}

	public void setType(String type) {
		this.type = type;
	}

	@Override
	public String toString() {
		return "FailureReport{" +
			"message='" + message + '\'' +
			", type='" + type + '\'' +
			'}';
	}
}
