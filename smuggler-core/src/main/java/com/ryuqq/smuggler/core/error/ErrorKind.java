package com.ryuqq.smuggler.core.error;

/**
 * 인코딩/디코딩 오류 종류.
 *
 * <p><strong>전파 정책:</strong></p>
 * <ul>
 *   <li>{@link #BAD_INPUT}: 호출 전체 실패 (호출자 계약 위반)</li>
 *   <li>{@link #BAD_KEY}, {@link #BAD_VALUE}: 디코딩 시 해당 항목만 무효 처리</li>
 *   <li>{@link #LOAD_ERROR}: 설정 소스 로딩 실패 (협력 컴포넌트 수준)</li>
 * </ul>
 *
 * @author Smuggler Team
 * @since 1.0.0
 */
public enum ErrorKind {

    /**
     * 인코딩/디코딩 인자의 최상위 형태가 기대한 컨테이너 타입이 아님.
     */
    BAD_INPUT("bad input"),

    /**
     * 인코딩된 키가 네임스페이스 태그로 시작하지 않거나 경로 세그먼트가 잘못됨.
     */
    BAD_KEY("invalid key"),

    /**
     * 값 텍스트가 리터럴 문법으로 파싱되지 않음.
     */
    BAD_VALUE("invalid value"),

    /**
     * 설정 소스를 읽거나 평가할 수 없음.
     */
    LOAD_ERROR("load error");

    private final String description;

    ErrorKind(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }

    /**
     * 항목 단위로 격리되는 오류인지 확인.
     *
     * @return BAD_KEY 또는 BAD_VALUE이면 true
     */
    public boolean isEntryScoped() {
        return this == BAD_KEY || this == BAD_VALUE;
    }
}
