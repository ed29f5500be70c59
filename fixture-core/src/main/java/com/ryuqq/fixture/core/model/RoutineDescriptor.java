package com.ryuqq.fixture.core.model;

/**
 * Setup/Teardown 루틴의 선언 정보.
 *
 * <p>외부 Discovery 단계가 루틴을 찾은 위치를 기록합니다.
 * Coordinator는 이 정보를 실패 메시지와 설정 오류 메시지에만 사용합니다.</p>
 *
 * @param declaringTypeName 루틴을 선언한 타입의 전체 이름 (예: com.example.OrderServiceTests)
 * @param routineName 루틴 이름 (예: initializeDatabase)
 *
 * @author Fixture Team
 * @since 1.0.0
 */
public record RoutineDescriptor(
    String declaringTypeName,
    String routineName
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException declaringTypeName 또는 routineName이 null이거나 빈 문자열인 경우
     */
    public RoutineDescriptor {
        if (declaringTypeName == null || declaringTypeName.isBlank()) {
            throw new IllegalArgumentException("declaringTypeName cannot be null or blank");
        }
        if (routineName == null || routineName.isBlank()) {
            throw new IllegalArgumentException("routineName cannot be null or blank");
        }
    }

    /**
     * RoutineDescriptor 생성.
     *
     * @param declaringTypeName 선언 타입 전체 이름
     * @param routineName 루틴 이름
     * @return RoutineDescriptor 인스턴스
     */
    public static RoutineDescriptor of(String declaringTypeName, String routineName) {
        return new RoutineDescriptor(declaringTypeName, routineName);
    }

    /**
     * Class 객체로부터 RoutineDescriptor 생성.
     *
     * @param declaringType 선언 타입
     * @param routineName 루틴 이름
     * @return RoutineDescriptor 인스턴스
     * @throws IllegalArgumentException declaringType이 null인 경우
     */
    public static RoutineDescriptor of(Class<?> declaringType, String routineName) {
        if (declaringType == null) {
            throw new IllegalArgumentException("declaringType cannot be null");
        }
        return new RoutineDescriptor(declaringType.getName(), routineName);
    }

    /**
     * 패키지와 외부 클래스를 제외한 단순 타입 이름.
     *
     * <p>예: {@code com.example.Outer$Inner} → {@code Inner}</p>
     *
     * @return 단순 타입 이름
     */
    public String simpleTypeName() {
        int index = Math.max(declaringTypeName.lastIndexOf('.'), declaringTypeName.lastIndexOf('$'));
        return declaringTypeName.substring(index + 1);
    }

    @Override
    public String toString() {
        return declaringTypeName + "." + routineName;
    }
}
