package com.ryuqq.smuggler.core.codec;

import com.ryuqq.smuggler.core.model.Literal;
import com.ryuqq.smuggler.core.model.OptionList;

import java.util.List;

/**
 * 쉼표로 구분된 인자 목록의 파싱 결과.
 *
 * <p>{@code :my_app, MyApp.Endpoint, url: [port: 4444]}는
 * positional {@code [:my_app, MyApp.Endpoint]}, options {@code [url: [port: 4444]]}가 됩니다.</p>
 *
 * @param positional 위치 인자
 * @param options 뒤따르는 옵션 쌍 (없으면 빈 목록)
 *
 * @author Smuggler Team
 * @since 1.0.0
 */
public record ArgumentList(List<Literal> positional, OptionList options) {

    public ArgumentList {
        if (positional == null) {
            throw new IllegalArgumentException("positional cannot be null");
        }
        if (options == null) {
            throw new IllegalArgumentException("options cannot be null");
        }
        positional = List.copyOf(positional);
    }
}
