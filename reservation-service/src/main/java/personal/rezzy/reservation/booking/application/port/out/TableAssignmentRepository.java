package personal.rezzy.reservation.booking.application.port.out;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Table Assignment Repository (Output Port)
 * 예약-테이블 배정 관계 저장소
 */
public interface TableAssignmentRepository {

    List<UUID> findTableIdsByReservationId(UUID reservationId);

    /**
     * 여러 예약의 배정 테이블을 한 번에 조회 (목록 조회 N+1 방지)
     */
    Map<UUID, List<UUID>> findTableIdsByReservationIds(Collection<UUID> reservationIds);

    void saveAll(UUID reservationId, Collection<UUID> tableIds);

    void deleteByReservationId(UUID reservationId);
}
