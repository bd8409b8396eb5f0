package com.ryuqq.smuggler.core.spi;

import com.ryuqq.smuggler.core.error.LoadException;
import com.ryuqq.smuggler.core.model.ConfigTree;

/**
 * 설정 소스 로딩 SPI (Service Provider Interface).
 *
 * <p>이미 평가된 {@link ConfigTree}를 제공합니다. 파일 형식 파싱, include 해석,
 * 최상위 구문 실행 등은 모두 구현체의 책임이며 코어는 관여하지 않습니다.</p>
 *
 * <p><strong>구현 책임:</strong></p>
 * <ul>
 *   <li>소스 이름 해석 (파일 경로, 리소스 이름, 원격 키 등)</li>
 *   <li>읽기/평가 실패 시 {@link LoadException} 발생</li>
 *   <li>null 반환 금지</li>
 * </ul>
 *
 * @author Smuggler Team
 * @since 1.0.0
 */
public interface ConfigLoader {

    /**
     * 설정 소스를 로드.
     *
     * @param source 소스 이름
     * @return 로드된 설정 트리
     * @throws LoadException 소스를 읽거나 평가할 수 없는 경우
     */
    ConfigTree load(String source);
}
