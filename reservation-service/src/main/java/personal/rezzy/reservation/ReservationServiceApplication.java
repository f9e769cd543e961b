package personal.rezzy.reservation;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.cache.annotation.EnableCaching;

/**
 * Reservation Service Application
 * 테이블, 영업시간, 고객, 예약 도메인을 포함하는 레스토랑 예약 서비스
 */
@EnableCaching     // 날짜별 영업시간 캐시
@ConfigurationPropertiesScan
@SpringBootApplication(
    scanBasePackages = {
        "personal.rezzy.reservation",
        "personal.rezzy.common"  // common 모듈의 GlobalExceptionHandler 등을 스캔
    }
)
public class ReservationServiceApplication {
    public static void main(String[] args) {
        SpringApplication.run(ReservationServiceApplication.class, args);
    }
}
