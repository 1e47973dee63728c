package com.deepansh.research.analysis;

/**
 * Outcome of the generate / evaluate / refine loop.
 *
 * @param iterations synthesis passes used, the first generation included
 * @param finalScore last normalized quality score (0.0 to 1.0)
 */
public record ReportDraft(String text, String template, int iterations, double finalScore) {
}
