package personal.rezzy.reservation.booking.adapter.in.web;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import personal.rezzy.reservation.booking.adapter.in.web.dto.AvailabilityRequest;
import personal.rezzy.reservation.booking.adapter.in.web.dto.AvailabilityResponse;
import personal.rezzy.reservation.booking.application.port.in.CheckAvailabilityUseCase;

/**
 * Availability API Controller
 * 인원과 시간으로 가용 테이블 조회 (락 없음, 참고용)
 */
@RestController
@RequestMapping("/api/v1/availability")
@RequiredArgsConstructor
public class AvailabilityController {

    private final CheckAvailabilityUseCase checkAvailabilityUseCase;

    @PostMapping
    public ResponseEntity<AvailabilityResponse> checkAvailability(@Valid @RequestBody AvailabilityRequest request) {
        return ResponseEntity.ok(AvailabilityResponse.from(checkAvailabilityUseCase.checkAvailability(request.toQuery())));
    }
}
