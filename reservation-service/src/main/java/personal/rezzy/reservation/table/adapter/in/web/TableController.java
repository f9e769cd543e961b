package personal.rezzy.reservation.table.adapter.in.web;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import personal.rezzy.common.dto.ApiResponse;
import personal.rezzy.reservation.table.adapter.in.web.dto.TableRequest;
import personal.rezzy.reservation.table.adapter.in.web.dto.TableResponse;
import personal.rezzy.reservation.table.application.port.in.GetTableUseCase;
import personal.rezzy.reservation.table.application.port.in.ManageTableUseCase;
import personal.rezzy.reservation.table.domain.model.TableFilter;

import java.util.List;
import java.util.UUID;

/**
 * Table API Controller
 * 테이블 조회 및 관리 REST API
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/tables")
@RequiredArgsConstructor
public class TableController {

    private final ManageTableUseCase manageTableUseCase;
    private final GetTableUseCase getTableUseCase;

    /**
     * 테이블 목록 조회
     * GET /api/v1/tables?minCapacity=&maxCapacity=&shared=&location=
     */
    @GetMapping
    public ResponseEntity<List<TableResponse>> getTables(
            @RequestParam(required = false) Integer minCapacity,
            @RequestParam(required = false) Integer maxCapacity,
            @RequestParam(required = false) Boolean shared,
            @RequestParam(required = false) String location
    ) {
        TableFilter filter = new TableFilter(minCapacity, maxCapacity, shared, location);
        List<TableResponse> response = getTableUseCase.getTables(filter).stream()
                .map(TableResponse::from)
                .toList();
        return ResponseEntity.ok(response);
    }

    @GetMapping("/{tableId}")
    public ResponseEntity<TableResponse> getTable(@PathVariable UUID tableId) {
        return ResponseEntity.ok(TableResponse.from(getTableUseCase.getTable(tableId)));
    }

    @PostMapping
    public ResponseEntity<TableResponse> createTable(@Valid @RequestBody TableRequest request) {
        log.info("Create table: tableNumber={}, capacity={}-{}",
                request.tableNumber(), request.minCapacity(), request.maxCapacity());

        TableResponse response = TableResponse.from(manageTableUseCase.createTable(request.toCreateCommand()));
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @PutMapping("/{tableId}")
    public ResponseEntity<TableResponse> updateTable(
            @PathVariable UUID tableId,
            @Valid @RequestBody TableRequest request
    ) {
        log.info("Update table: tableId={}, tableNumber={}", tableId, request.tableNumber());

        TableResponse response = TableResponse.from(manageTableUseCase.updateTable(request.toUpdateCommand(tableId)));
        return ResponseEntity.ok(response);
    }

    @DeleteMapping("/{tableId}")
    public ResponseEntity<ApiResponse<Void>> deleteTable(@PathVariable UUID tableId) {
        log.info("Delete table: tableId={}", tableId);

        manageTableUseCase.deleteTable(tableId);
        return ResponseEntity.ok(ApiResponse.success("Table deleted"));
    }
}
