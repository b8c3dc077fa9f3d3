package io.admissionpolicy.cli.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.admissionpolicy.core.validation.Violation;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.util.List;

/**
 * JSON report: an array with one object per file,
 * {@code {file, policy, valid, violations: [{kind, message, path, rule}]}},
 * plus {@code error} for files that could not be parsed.
 */
public final class JsonReportWriter implements ReportWriter {

    private static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    @Override
    public void write(List<FileReport> reports, PrintStream out) {
        try {
            out.println(MAPPER.writeValueAsString(toJson(reports)));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize validation report", e);
        }
    }

    ArrayNode toJson(List<FileReport> reports) {
        ArrayNode array = NODES.arrayNode();
        for (FileReport report : reports) {
            ObjectNode node = array.addObject();
            node.put("file", report.file().toString());
            node.put("policy", report.policyName());
            node.put("valid", report.isValid());
            ArrayNode violations = node.putArray("violations");
            for (Violation violation : report.violations()) {
                ObjectNode v = violations.addObject();
                v.put("kind", violation.kind().name());
                v.put("message", violation.message());
                v.put("path", violation.path());
                v.put("rule", violation.rule());
            }
            if (report.isFailed()) {
                node.put("error", report.error());
            }
        }
        return array;
    }
}
