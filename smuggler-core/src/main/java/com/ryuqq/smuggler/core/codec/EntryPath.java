package com.ryuqq.smuggler.core.codec;

import com.ryuqq.smuggler.core.model.Identifier;

import java.util.List;

/**
 * 디코딩된 키 경로 (앱 + 옵션 경로).
 *
 * @param app 앱 식별자
 * @param path 앱 아래의 옵션 경로 (1개 이상)
 *
 * @author Smuggler Team
 * @since 1.0.0
 */
public record EntryPath(Identifier app, List<Identifier> path) {

    public EntryPath {
        if (app == null) {
            throw new IllegalArgumentException("app cannot be null");
        }
        if (path == null || path.isEmpty()) {
            throw new IllegalArgumentException("path cannot be null or empty");
        }
        path = List.copyOf(path);
    }
}
