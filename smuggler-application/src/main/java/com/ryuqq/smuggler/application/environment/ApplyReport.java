package com.ryuqq.smuggler.application.environment;

import com.ryuqq.smuggler.core.outcome.InvalidEntry;

import java.util.List;

/**
 * 환경 적용 결과.
 *
 * @param appliedOptions {@code Environment.set}으로 기록한 (앱, 키) 수
 * @param skippedEntries 디코딩에 실패하여 적용하지 않은 항목
 *
 * @author Smuggler Team
 * @since 1.0.0
 */
public record ApplyReport(int appliedOptions, List<InvalidEntry> skippedEntries) {

    public ApplyReport {
        if (appliedOptions < 0) {
            throw new IllegalArgumentException("appliedOptions cannot be negative (current: " + appliedOptions + ")");
        }
        if (skippedEntries == null) {
            throw new IllegalArgumentException("skippedEntries cannot be null");
        }
        skippedEntries = List.copyOf(skippedEntries);
    }

    public boolean hasSkippedEntries() {
        return !skippedEntries.isEmpty();
    }
}
