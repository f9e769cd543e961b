package personal.rezzy.reservation.booking.domain.model;

import personal.rezzy.reservation.customer.domain.model.Customer;
import personal.rezzy.reservation.table.domain.model.DiningTable;

import java.util.List;

/**
 * 고객과 배정 테이블을 포함한 예약 전체 정보
 */
public record ReservationDetails(
        Reservation reservation,
        Customer customer,
        List<DiningTable> tables) {

    public ReservationDetails {
        tables = List.copyOf(tables);
    }
}
