package com.ryuqq.fixture.testkit.contract;

/**
 * Contract Test용 실행 컨텍스트.
 *
 * @param runId 실행(run) 식별자
 * @param workerName 호출한 워커 이름
 *
 * @author Fixture Team
 * @since 1.0.0
 */
public record ContractContext(String runId, String workerName) {

    /**
     * 현재 스레드 이름으로 컨텍스트 생성.
     *
     * @param runId 실행 식별자
     * @return ContractContext 인스턴스
     */
    public static ContractContext forCurrentThread(String runId) {
        return new ContractContext(runId, Thread.currentThread().getName());
    }
}
