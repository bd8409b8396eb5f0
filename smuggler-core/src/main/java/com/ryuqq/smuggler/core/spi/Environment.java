package com.ryuqq.smuggler.core.spi;

import com.ryuqq.smuggler.core.model.Identifier;
import com.ryuqq.smuggler.core.model.Literal;
import com.ryuqq.smuggler.core.model.OptionList;

import java.util.Optional;

/**
 * 설정 값을 보관하는 환경 SPI (Service Provider Interface).
 *
 * <p>디코딩된 설정을 적용하는 협력 컴포넌트에 주입되는 get/set 기능입니다.
 * 코어 변환은 이 인터페이스를 호출하지 않습니다.</p>
 *
 * <p><strong>구현 요구사항:</strong></p>
 * <ul>
 *   <li>Thread-safe: 모든 메서드는 여러 스레드에서 안전하게 호출 가능해야 함</li>
 *   <li>{@code set}은 해당 (app, key)의 값을 통째로 교체함 (병합은 호출자 책임)</li>
 * </ul>
 *
 * @author Smuggler Team
 * @since 1.0.0
 */
public interface Environment {

    /**
     * 현재 값 조회.
     *
     * @param app 앱 식별자
     * @param key 옵션 키
     * @return 현재 값 (없으면 empty)
     * @throws IllegalArgumentException app 또는 key가 null인 경우
     */
    Optional<Literal> get(Identifier app, Identifier key);

    /**
     * 현재 값 설정.
     *
     * @param app 앱 식별자
     * @param key 옵션 키
     * @param value 새 값
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    void set(Identifier app, Identifier key, Literal value);

    /**
     * 앱의 모든 옵션 조회.
     *
     * @param app 앱 식별자
     * @return 앱의 옵션 목록 (없으면 빈 목록)
     * @throws IllegalArgumentException app이 null인 경우
     */
    OptionList getAll(Identifier app);
}
