package personal.rezzy.reservation.booking.adapter.out.persistence;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import personal.rezzy.reservation.booking.domain.model.ReservationStatus;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * Spring Data JPA Repository for Table Assignment
 */
public interface JpaTableAssignmentRepository extends JpaRepository<TableAssignmentEntity, UUID> {

    List<TableAssignmentEntity> findByReservationId(UUID reservationId);

    List<TableAssignmentEntity> findByReservationIdIn(Collection<UUID> reservationIds);

    @Query("SELECT new personal.rezzy.reservation.booking.adapter.out.persistence.TableOccupancyRow("
            + "a.reservationId, a.tableId, r.partySize, r.reservationDate, r.startTime, r.durationMinutes, r.status) "
            + "FROM TableAssignmentEntity a JOIN ReservationEntity r ON r.id = a.reservationId "
            + "WHERE r.reservationDate = :date AND r.status IN :statuses")
    List<TableOccupancyRow> findOccupancies(@Param("date") LocalDate date,
                                            @Param("statuses") Collection<ReservationStatus> statuses);

    @Query("SELECT new personal.rezzy.reservation.booking.adapter.out.persistence.TableOccupancyRow("
            + "a.reservationId, a.tableId, r.partySize, r.reservationDate, r.startTime, r.durationMinutes, r.status) "
            + "FROM TableAssignmentEntity a JOIN ReservationEntity r ON r.id = a.reservationId "
            + "WHERE r.reservationDate = :date AND r.status IN :statuses AND a.tableId IN :tableIds")
    List<TableOccupancyRow> findOccupancies(@Param("date") LocalDate date,
                                            @Param("statuses") Collection<ReservationStatus> statuses,
                                            @Param("tableIds") Collection<UUID> tableIds);

    @Query("SELECT new personal.rezzy.reservation.booking.adapter.out.persistence.TableOccupancyRow("
            + "a.reservationId, a.tableId, r.partySize, r.reservationDate, r.startTime, r.durationMinutes, r.status) "
            + "FROM TableAssignmentEntity a JOIN ReservationEntity r ON r.id = a.reservationId "
            + "WHERE a.tableId = :tableId AND r.reservationDate >= :fromDate AND r.status IN :statuses")
    List<TableOccupancyRow> findOccupanciesFrom(@Param("tableId") UUID tableId,
                                                @Param("fromDate") LocalDate fromDate,
                                                @Param("statuses") Collection<ReservationStatus> statuses);

    @Query("SELECT COUNT(a) > 0 FROM TableAssignmentEntity a JOIN ReservationEntity r ON r.id = a.reservationId "
            + "WHERE a.tableId = :tableId AND r.status IN :statuses")
    boolean existsByTableIdAndStatusIn(@Param("tableId") UUID tableId,
                                       @Param("statuses") Collection<ReservationStatus> statuses);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM TableAssignmentEntity a WHERE a.reservationId = :reservationId")
    int deleteByReservationId(@Param("reservationId") UUID reservationId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM TableAssignmentEntity a WHERE a.tableId = :tableId")
    int deleteByTableId(@Param("tableId") UUID tableId);
}
