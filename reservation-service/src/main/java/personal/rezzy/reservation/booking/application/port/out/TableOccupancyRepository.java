package personal.rezzy.reservation.booking.application.port.out;

import personal.rezzy.reservation.booking.domain.model.TableOccupancy;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * Table Occupancy Repository (Output Port)
 * 날짜별로 테이블을 차지하고 있는 예약(pending, confirmed, seated, completed) 조회
 */
public interface TableOccupancyRepository {

    List<TableOccupancy> findOccupying(LocalDate date);

    List<TableOccupancy> findOccupying(LocalDate date, Collection<UUID> tableIds);
}
