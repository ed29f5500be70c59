package com.ryuqq.fixture.core.model;

/**
 * Fixture Scope 식별자.
 *
 * <p>하나의 Scope(예: 테스트 어셈블리, 테스트 스위트)는 하나의 setup 루틴과
 * 하나의 teardown 루틴, 그리고 하나의 Coordinator 인스턴스를 소유합니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~255자</li>
 * </ul>
 *
 * @author Fixture Team
 * @since 1.0.0
 */
public final class ScopeId {

    private static final int MAX_LENGTH = 255;

    private final String value;

    private ScopeId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("ScopeId cannot be null or blank");
        }
        if (value.length() > MAX_LENGTH) {
            throw new IllegalArgumentException("ScopeId length cannot exceed " + MAX_LENGTH + " characters");
        }
        this.value = value;
    }

    /**
     * ScopeId 생성.
     *
     * @param value Scope 이름 (예: com.example.OrderServiceTests)
     * @return ScopeId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static ScopeId of(String value) {
        return new ScopeId(value);
    }

    /**
     * Scope 이름 조회.
     *
     * @return Scope 이름
     */
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ScopeId scopeId = (ScopeId) o;
        return value.equals(scopeId.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "ScopeId{" + value + '}';
    }
}
