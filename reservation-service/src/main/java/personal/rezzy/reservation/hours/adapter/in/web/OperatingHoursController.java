package personal.rezzy.reservation.hours.adapter.in.web;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import personal.rezzy.reservation.hours.adapter.in.web.dto.EffectiveHoursResponse;
import personal.rezzy.reservation.hours.adapter.in.web.dto.OperatingHoursRequest;
import personal.rezzy.reservation.hours.adapter.in.web.dto.OperatingHoursResponse;
import personal.rezzy.reservation.hours.application.port.in.GetOperatingHoursUseCase;
import personal.rezzy.reservation.hours.application.port.in.ManageOperatingHoursUseCase;

import java.time.LocalDate;
import java.util.List;

/**
 * Operating Hours API Controller
 * 요일 영업시간 조회/설정
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/hours")
@RequiredArgsConstructor
public class OperatingHoursController {

    private final ManageOperatingHoursUseCase manageOperatingHoursUseCase;
    private final GetOperatingHoursUseCase getOperatingHoursUseCase;

    @GetMapping
    public ResponseEntity<List<OperatingHoursResponse>> getWeeklyHours() {
        List<OperatingHoursResponse> response = getOperatingHoursUseCase.getWeeklyHours().stream()
                .map(OperatingHoursResponse::from)
                .toList();
        return ResponseEntity.ok(response);
    }

    /**
     * 요일 영업시간 설정 (요일 기준 upsert)
     * PUT /api/v1/hours
     */
    @PutMapping
    public ResponseEntity<OperatingHoursResponse> setWeeklyHours(@Valid @RequestBody OperatingHoursRequest request) {
        log.info("Set weekly hours: dayOfWeek={}", request.dayOfWeek());
        return ResponseEntity.ok(OperatingHoursResponse.from(
                manageOperatingHoursUseCase.setWeeklyHours(request.toCommand())));
    }

    /**
     * 날짜에 적용되는 영업시간
     * GET /api/v1/hours/effective?date=2025-05-01
     */
    @GetMapping("/effective")
    public ResponseEntity<EffectiveHoursResponse> getEffectiveHours(
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date
    ) {
        return ResponseEntity.ok(EffectiveHoursResponse.from(getOperatingHoursUseCase.getEffectiveHours(date)));
    }
}
