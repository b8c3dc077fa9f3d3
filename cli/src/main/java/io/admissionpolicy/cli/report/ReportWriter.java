package io.admissionpolicy.cli.report;

import io.admissionpolicy.cli.config.ValidatorConfig;
import java.io.PrintStream;
import java.util.List;

/** Renders file reports in one output format. */
public interface ReportWriter {

    /**
     * Writes all reports, in the order given, to {@code out}.
     *
     * @param reports reports in display order
     * @param out     destination stream
     */
    void write(List<FileReport> reports, PrintStream out);

    /** Returns the writer for {@code text} or {@code json}. */
    static ReportWriter forFormat(String format) {
        if (ValidatorConfig.FORMAT_JSON.equals(format)) {
            return new JsonReportWriter();
        }
        if (ValidatorConfig.FORMAT_TEXT.equals(format)) {
            return new TextReportWriter();
        }
        throw new IllegalArgumentException("Unsupported report format: " + format);
    }
}
