package personal.rezzy.reservation.booking.adapter.in.web;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import personal.rezzy.common.dto.ApiResponse;
import personal.rezzy.reservation.booking.adapter.in.web.dto.CreateReservationRequest;
import personal.rezzy.reservation.booking.adapter.in.web.dto.ReservationResponse;
import personal.rezzy.reservation.booking.adapter.in.web.dto.UpdateReservationRequest;
import personal.rezzy.reservation.booking.application.port.in.BookReservationUseCase;
import personal.rezzy.reservation.booking.application.port.in.GetReservationUseCase;
import personal.rezzy.reservation.booking.application.port.in.ManageReservationUseCase;
import personal.rezzy.reservation.booking.domain.model.ReservationFilter;
import personal.rezzy.reservation.booking.domain.model.ReservationStatus;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Reservation API Controller
 * 예약 생성, 조회, 수정, 상태 변경, 삭제 REST API
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/reservations")
@RequiredArgsConstructor
public class ReservationController {

    private final BookReservationUseCase bookReservationUseCase;
    private final ManageReservationUseCase manageReservationUseCase;
    private final GetReservationUseCase getReservationUseCase;

    /**
     * 예약 생성
     * POST /api/v1/reservations
     */
    @PostMapping
    public ResponseEntity<ReservationResponse> createReservation(@Valid @RequestBody CreateReservationRequest request) {
        log.info("Create reservation: partySize={}, date={}, start={}, tableIds={}",
                request.partySize(), request.reservationDate(), request.startTime(), request.tableIds());

        ReservationResponse response = ReservationResponse.from(bookReservationUseCase.book(request.toCommand()));
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    /**
     * 예약 목록 조회
     * GET /api/v1/reservations?dateFrom=&dateTo=&tableId=&status=&customerId=&limit=100&offset=0
     */
    @GetMapping
    public ResponseEntity<List<ReservationResponse>> getReservations(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate dateFrom,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate dateTo,
            @RequestParam(required = false) UUID tableId,
            @RequestParam(required = false) String status,
            @RequestParam(required = false) UUID customerId,
            @RequestParam(defaultValue = "" + ReservationFilter.DEFAULT_LIMIT) int limit,
            @RequestParam(defaultValue = "0") int offset
    ) {
        ReservationFilter filter = new ReservationFilter(
                dateFrom,
                dateTo,
                tableId,
                status != null ? ReservationStatus.from(status) : null,
                customerId,
                limit,
                offset);

        List<ReservationResponse> response = getReservationUseCase.getReservations(filter).stream()
                .map(ReservationResponse::from)
                .toList();
        return ResponseEntity.ok(response);
    }

    @GetMapping("/{reservationId}")
    public ResponseEntity<ReservationResponse> getReservation(@PathVariable UUID reservationId) {
        return ResponseEntity.ok(ReservationResponse.from(getReservationUseCase.getReservation(reservationId)));
    }

    /**
     * 예약 부분 수정
     * PUT /api/v1/reservations/{reservationId}
     */
    @PutMapping("/{reservationId}")
    public ResponseEntity<ReservationResponse> updateReservation(
            @PathVariable UUID reservationId,
            @Valid @RequestBody UpdateReservationRequest request
    ) {
        log.info("Update reservation: reservationId={}", reservationId);

        ReservationResponse response = ReservationResponse.from(
                manageReservationUseCase.updateReservation(request.toCommand(reservationId)));
        return ResponseEntity.ok(response);
    }

    /**
     * 예약 상태 변경
     * PATCH /api/v1/reservations/{reservationId}/status?status=confirmed
     */
    @PatchMapping("/{reservationId}/status")
    public ResponseEntity<ReservationResponse> changeStatus(
            @PathVariable UUID reservationId,
            @RequestParam String status
    ) {
        log.info("Change reservation status: reservationId={}, status={}", reservationId, status);

        ReservationResponse response = ReservationResponse.from(
                manageReservationUseCase.changeStatus(reservationId, ReservationStatus.from(status)));
        return ResponseEntity.ok(response);
    }

    @DeleteMapping("/{reservationId}")
    public ResponseEntity<ApiResponse<Void>> deleteReservation(@PathVariable UUID reservationId) {
        log.info("Delete reservation: reservationId={}", reservationId);
        manageReservationUseCase.deleteReservation(reservationId);
        return ResponseEntity.ok(ApiResponse.success("Reservation deleted"));
    }
}
