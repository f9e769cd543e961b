package personal.rezzy.common.dto;

/**
 * Health Check 응답 데이터
 *
 * @param database 데이터베이스 상태 ("UP" 또는 "DOWN")
 * @param redis    Redis 상태 ("UP" 또는 "DOWN")
 */
public record HealthCheckResponse(
        String database,
        String redis
) {
    public boolean isHealthy() {
        return "UP".equals(database) && "UP".equals(redis);
    }
}
