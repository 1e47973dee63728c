package com.deepansh.research.analysis;

import java.util.List;

public record QualityEvaluation(double score, List<String> strengths, List<String> gaps, String summary) {
}
