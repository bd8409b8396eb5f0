package com.ryuqq.smuggler.application.smuggler;

import com.ryuqq.smuggler.core.model.ConfigTree;
import com.ryuqq.smuggler.core.outcome.InvalidEntry;

import java.util.List;

/**
 * 디코딩 결과.
 *
 * @param tree 유효한 항목을 병합한 트리
 * @param invalidEntries 제외된 항목 (키 오름차순)
 *
 * @author Smuggler Team
 * @since 1.0.0
 */
public record DecodeResult(ConfigTree tree, List<InvalidEntry> invalidEntries) {

    public DecodeResult {
        if (tree == null) {
            throw new IllegalArgumentException("tree cannot be null");
        }
        if (invalidEntries == null) {
            throw new IllegalArgumentException("invalidEntries cannot be null");
        }
        invalidEntries = List.copyOf(invalidEntries);
    }

    public boolean hasInvalidEntries() {
        return !invalidEntries.isEmpty();
    }
}
