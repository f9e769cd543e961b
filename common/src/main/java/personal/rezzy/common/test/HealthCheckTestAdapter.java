package personal.rezzy.common.test;

import io.restassured.response.Response;

/**
 * Health Check 테스트 어댑터 인터페이스 (Port)
 * 각 서비스가 자신의 Health Check 검증 방식을 구현
 */
public interface HealthCheckTestAdapter {

    /**
     * 헬스 체크 API 호출
     * 공통 엔드포인트: /api/v1/health
     */
    Response callHealthCheckApi();

    void verifyStatusCode(Response response, int expectedStatusCode);

    /**
     * API 응답 결과 검증 ("success" / "error")
     */
    void verifyResult(Response response, String expectedResult);

    /**
     * 데이터베이스 상태 정보 검증
     */
    void verifyDatabaseStatus(Response response, String expectedStatus);

    /**
     * Redis 상태 정보 검증 (값 존재 여부만 확인)
     */
    void verifyRedisStatus(Response response);
}
