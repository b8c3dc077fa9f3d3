package io.admissionpolicy.cli.report;

import io.admissionpolicy.core.validation.Violation;
import java.io.PrintStream;
import java.util.List;

/**
 * Plain-text report:
 *
 * <pre>
 * policies/a.yaml: OK
 * policies/b.yaml: INVALID
 *   MISSING_PATTERN [rule=r1]: neither pattern nor anyPattern found in rule 'r1'
 * policies/c.yaml: ERROR Failed to parse YAML: ...
 * 3 file(s) checked, 2 failed
 * </pre>
 */
public final class TextReportWriter implements ReportWriter {

    @Override
    public void write(List<FileReport> reports, PrintStream out) {
        int failed = 0;
        for (FileReport report : reports) {
            if (report.isFailed()) {
                out.println(report.file() + ": ERROR " + report.error());
            } else if (report.isValid()) {
                out.println(report.file() + ": OK");
            } else {
                out.println(report.file() + ": INVALID");
                for (Violation violation : report.violations()) {
                    out.println("  " + violation);
                }
            }
            if (!report.isValid()) {
                failed++;
            }
        }
        out.println(reports.size() + " file(s) checked, " + failed + " failed");
    }
}
