package com.elclab.components.util;

import com.elclab.components.domain.CandidateRecord;

/**
 * One data row produced by {@link CsvRecordParser}: either a valid
 * {@link CandidateRecord} or the reason the row was skipped.
 */
public final class ParsedRow {

    private final int             lineNumber;
    private final String          rawLine;
    private final CandidateRecord candidate;
    private final String          skipReason;

    private ParsedRow(int lineNumber, String rawLine,
                      CandidateRecord candidate, String skipReason) {
        this.lineNumber = lineNumber;
        this.rawLine    = rawLine;
        this.candidate  = candidate;
        this.skipReason = skipReason;
    }

    static ParsedRow candidate(int lineNumber, String rawLine, CandidateRecord candidate) {
        return new ParsedRow(lineNumber, rawLine, candidate, null);
    }

    static ParsedRow skipped(int lineNumber, String rawLine, String reason) {
        return new ParsedRow(lineNumber, rawLine, null, reason);
    }

    /** @return 1-based physical line number in the source */
    public int getLineNumber()             { return lineNumber; }
    public String getRawLine()             { return rawLine; }

    /** @return the candidate, or null for a skipped row */
    public CandidateRecord getCandidate()  { return candidate; }

    /** @return why the row was skipped, or null for a candidate row */
    public String getSkipReason()          { return skipReason; }

    public boolean isSkipped() {
        return candidate == null;
    }

    @Override
    public String toString() {
        return "ParsedRow{line=" + lineNumber
                + (isSkipped() ? ", skipped='" + skipReason + "'" : ", " + candidate)
                + "}";
    }
}
