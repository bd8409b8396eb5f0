package com.ryuqq.smuggler.core.outcome;

import com.ryuqq.smuggler.core.model.Identifier;
import com.ryuqq.smuggler.core.model.OptionList;

/**
 * 디코딩에 성공한 항목.
 *
 * <p>{@code options}는 키 경로를 따라 단일 키 OptionList로 중첩된 값입니다.
 * 예를 들어 {@code elixir-my_app-url-port => 4444}는
 * app {@code my_app}, options {@code [url: [port: 4444]]}가 됩니다.</p>
 *
 * @param key 원본 인코딩 키
 * @param value 원본 인코딩 값
 * @param app 앱 식별자
 * @param options 경로를 따라 중첩된 옵션
 *
 * @author Smuggler Team
 * @since 1.0.0
 */
public record DecodedEntry(
    String key,
    String value,
    Identifier app,
    OptionList options
) implements EntryOutcome {

    public DecodedEntry {
        if (key == null || value == null) {
            throw new IllegalArgumentException("key and value cannot be null");
        }
        if (app == null) {
            throw new IllegalArgumentException("app cannot be null");
        }
        if (options == null) {
            throw new IllegalArgumentException("options cannot be null");
        }
    }
}
