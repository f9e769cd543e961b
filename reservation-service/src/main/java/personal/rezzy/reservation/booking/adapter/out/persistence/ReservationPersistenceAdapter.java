package personal.rezzy.reservation.booking.adapter.out.persistence;

import jakarta.persistence.EntityManager;
import jakarta.persistence.TypedQuery;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.rezzy.reservation.booking.application.port.out.ReservationRepository;
import personal.rezzy.reservation.booking.domain.model.Reservation;
import personal.rezzy.reservation.booking.domain.model.ReservationFilter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Reservation Persistence Adapter
 * JPA를 사용한 예약 저장소 구현체
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ReservationPersistenceAdapter implements ReservationRepository {

    private final JpaReservationRepository jpaReservationRepository;
    private final EntityManager entityManager;

    @Override
    public Optional<Reservation> findById(UUID reservationId) {
        log.debug("Finding reservation: reservationId={}", reservationId);
        return jpaReservationRepository.findById(reservationId)
                .map(ReservationEntity::toDomain);
    }

    @Override
    public Optional<Reservation> findByIdForUpdate(UUID reservationId) {
        log.debug("Locking reservation: reservationId={}", reservationId);
        return jpaReservationRepository.findByIdForUpdate(reservationId)
                .map(ReservationEntity::toDomain);
    }

    /**
     * 조건에 있는 항목만 WHERE 절에 넣어 JPQL을 만든다.
     * offset/limit이 페이지 크기의 배수가 아닐 수 있어 Pageable 대신 setFirstResult를 사용한다.
     */
    @Override
    public List<Reservation> findAll(ReservationFilter filter) {
        StringBuilder jpql = new StringBuilder("SELECT r FROM ReservationEntity r");
        List<String> conditions = new ArrayList<>();
        Map<String, Object> parameters = new LinkedHashMap<>();

        if (filter.dateFrom() != null) {
            conditions.add("r.reservationDate >= :dateFrom");
            parameters.put("dateFrom", filter.dateFrom());
        }
        if (filter.dateTo() != null) {
            conditions.add("r.reservationDate <= :dateTo");
            parameters.put("dateTo", filter.dateTo());
        }
        if (filter.status() != null) {
            conditions.add("r.status = :status");
            parameters.put("status", filter.status());
        }
        if (filter.customerId() != null) {
            conditions.add("r.customerId = :customerId");
            parameters.put("customerId", filter.customerId());
        }
        if (filter.tableId() != null) {
            conditions.add("r.id IN (SELECT a.reservationId FROM TableAssignmentEntity a WHERE a.tableId = :tableId)");
            parameters.put("tableId", filter.tableId());
        }

        if (!conditions.isEmpty()) {
            jpql.append(" WHERE ").append(String.join(" AND ", conditions));
        }
        jpql.append(" ORDER BY r.reservationDate, r.startTime, r.createdAt");

        TypedQuery<ReservationEntity> query = entityManager.createQuery(jpql.toString(), ReservationEntity.class);
        parameters.forEach(query::setParameter);

        List<Reservation> reservations = query
                .setFirstResult(filter.offset())
                .setMaxResults(filter.limit())
                .getResultList()
                .stream()
                .map(ReservationEntity::toDomain)
                .toList();
        log.debug("Found {} reservations: filter={}", reservations.size(), filter);
        return reservations;
    }

    @Override
    public Reservation save(Reservation reservation) {
        log.debug("Saving reservation: reservationId={}, status={}", reservation.id(), reservation.status());
        // 제약 위반을 호출 지점에서 감지하기 위해 즉시 flush
        return jpaReservationRepository.saveAndFlush(ReservationEntity.fromDomain(reservation))
                .toDomain();
    }

    @Override
    public void deleteById(UUID reservationId) {
        jpaReservationRepository.deleteById(reservationId);
        jpaReservationRepository.flush();
    }
}
