package personal.rezzy.reservation.table.application.port.out;

import personal.rezzy.reservation.table.domain.model.TableUsage;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Table Usage Repository (Output Port)
 * 테이블 수정/삭제 전 예약 배정 현황 확인과 정리를 담당
 */
public interface TableUsageRepository {

    /**
     * 진행 중인 예약(pending, confirmed, seated)에 배정되어 있는지 확인
     */
    boolean hasInProgressReservation(UUID tableId);

    /**
     * fromDate 이후 테이블을 차지하는 예약(pending, confirmed, seated, completed)
     */
    List<TableUsage> findOccupyingFrom(UUID tableId, LocalDate fromDate);

    /**
     * 테이블에 걸린 과거 배정 기록 삭제
     */
    void deleteAssignmentsByTableId(UUID tableId);
}
