package dev.cpputest.adapter.report;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlElementWrapper;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlProperty;
import com.fasterxml.jackson.dataformat.xml.annotation.JacksonXmlRootElement;

import java.util.List;

/**
 * One JUnit XML document as written by {@code -ojunit}. CppUTest writes one per test group.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JacksonXmlRootElement(localName = "testsuite")
public class TestSuiteReport {

	@JacksonXmlProperty(isAttribute = true, localName = "name")
	private String name;

	@JacksonXmlElementWrapper(useWrapping = false)
	@JacksonXmlProperty(localName = "testcase")
	private List<TestCaseReport> testCases = List.of();

	public String getName() {
		return name;
	}

	public void setName(String name) {
		this.name = name;
	}

	public List<TestCaseReport> getTestCases() {
		return testCases;
	}

	public void setTestCases(List<TestCaseReport> testCases) {
		this.testCases = testCases == null ? List.of() : testCases;
	}

	@Override
	public String toString() {
		return "TestSuiteReport{" +
			"name='" + name + '\'' +
			", testCases=" + testCases +
			'}';
	}
}
