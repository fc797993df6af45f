package dev.cpputest.adapter.report;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public class TestCaseReport {

	@JacksonXmlProperty(isAttribute = true, localName = "classname")
	private String className;

	@JacksonXmlProperty(isAttribute = true, localName = "name")
	private String name;

	@JacksonXmlProperty(isAttribute = true, localName = "file")
	private String file;

	@JacksonXmlProperty(isAttribute = true, localName = "line")
	private String line;

	@JacksonXmlProperty(localName = "failure")
	private FailureReport failure;

	public String getClassName() {
		return className;
	}

	public void setClassName(String className) {
		this.className = className;
	}

	public String getName() {
		return name;
	}

	public void setName(String name) {
		this.name = name;
	}

	public String getFile() {
		return file;
	}

	public void setFile(String file) {
		this.file = file;
	}

	public String getLine() {
		return line;
	}

	public void setLine(String line) {
		this.line = line;
	}

	public FailureReport getFailure() {
		return failure;
	}

	public void setFailure(FailureReport failure) {
		this.failure = failure;
	}

	@Override
	public String toString() {
		return "TestCaseReport{" +
			"className='" + className + '\'' +
			", name='" + name + '\'' +
			", file='" + file + '\'' +
			", line='" + line + '\'' +
			", failure=" + failure +
			'}';
	}
}
