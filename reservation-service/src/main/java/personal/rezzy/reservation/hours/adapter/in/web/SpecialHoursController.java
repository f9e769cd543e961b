package personal.rezzy.reservation.hours.adapter.in.web;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import personal.rezzy.common.dto.ApiResponse;
import personal.rezzy.reservation.hours.adapter.in.web.dto.SpecialHoursRequest;
import personal.rezzy.reservation.hours.adapter.in.web.dto.SpecialHoursResponse;
import personal.rezzy.reservation.hours.application.port.in.GetOperatingHoursUseCase;
import personal.rezzy.reservation.hours.application.port.in.ManageOperatingHoursUseCase;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Special Hours API Controller
 * 날짜별 특별 영업시간(휴무, 단축 영업 등) 관리
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/special-hours")
@RequiredArgsConstructor
public class SpecialHoursController {

    private final ManageOperatingHoursUseCase manageOperatingHoursUseCase;
    private final GetOperatingHoursUseCase getOperatingHoursUseCase;

    @GetMapping
    public ResponseEntity<List<SpecialHoursResponse>> getSpecialHours(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate dateFrom,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate dateTo
    ) {
        List<SpecialHoursResponse> response = getOperatingHoursUseCase.getSpecialHours(dateFrom, dateTo).stream()
                .map(SpecialHoursResponse::from)
                .toList();
        return ResponseEntity.ok(response);
    }

    @GetMapping("/{date}")
    public ResponseEntity<SpecialHoursResponse> getSpecialHoursByDate(
            @PathVariable @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date
    ) {
        return ResponseEntity.ok(SpecialHoursResponse.from(getOperatingHoursUseCase.getSpecialHours(date)));
    }

    /**
     * 특별 영업시간 설정 (날짜 기준 upsert)
     * PUT /api/v1/special-hours
     */
    @PutMapping
    public ResponseEntity<SpecialHoursResponse> setSpecialHours(@Valid @RequestBody SpecialHoursRequest request) {
        log.info("Set special hours: date={}, name={}, closed={}",
                request.date(), request.name(), request.closed());
        return ResponseEntity.ok(SpecialHoursResponse.from(
                manageOperatingHoursUseCase.setSpecialHours(request.toCommand())));
    }

    @DeleteMapping("/{specialHoursId}")
    public ResponseEntity<ApiResponse<Void>> deleteSpecialHours(@PathVariable UUID specialHoursId) {
        log.info("Delete special hours: specialHoursId={}", specialHoursId);
        manageOperatingHoursUseCase.deleteSpecialHours(specialHoursId);
        return ResponseEntity.ok(ApiResponse.success("Special hours deleted"));
    }
}
