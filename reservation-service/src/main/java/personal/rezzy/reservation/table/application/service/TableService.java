package personal.rezzy.reservation.table.application.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import personal.rezzy.reservation.table.application.port.in.CreateTableCommand;
import personal.rezzy.reservation.table.application.port.in.GetTableUseCase;
import personal.rezzy.reservation.table.application.port.in.ManageTableUseCase;
import personal.rezzy.reservation.table.application.port.in.UpdateTableCommand;
import personal.rezzy.reservation.table.application.port.out.ChairRepository;
import personal.rezzy.reservation.table.application.port.out.TableRepository;
import personal.rezzy.reservation.table.application.port.out.TableUsageRepository;
import personal.rezzy.reservation.table.domain.exception.DuplicateTableNumberException;
import personal.rezzy.reservation.table.domain.exception.TableInUseException;
import personal.rezzy.reservation.table.domain.exception.TableNotFoundException;
import personal.rezzy.reservation.table.domain.model.ChairResize;
import personal.rezzy.reservation.table.domain.model.DiningTable;
import personal.rezzy.reservation.table.domain.model.TableFilter;
import personal.rezzy.reservation.table.domain.model.TableSchedule;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Table Application Service
 * 테이블 관리와 의자 레코드 동기화
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TableService implements ManageTableUseCase, GetTableUseCase {

    private final TableRepository tableRepository;
    private final ChairRepository chairRepository;
    private final TableUsageRepository tableUsageRepository;

    @Override
    @Transactional
    public DiningTable createTable(CreateTableCommand command) {
        if (tableRepository.existsByTableNumber(command.tableNumber())) {
            throw new DuplicateTableNumberException(command.tableNumber());
        }

        DiningTable table = DiningTable.create(
                command.tableNumber(),
                command.minCapacity(),
                command.maxCapacity(),
                command.shared(),
                command.location());

        DiningTable saved = saveUnique(table);

        ChairResize resize = ChairResize.of(saved.id(), List.of(), saved.maxCapacity());
        chairRepository.saveAll(resize.added());

        log.info("Table created: tableId={}, tableNumber={}, capacity={}-{}, shared={}, chairs={}",
                saved.id(), saved.tableNumber(), saved.minCapacity(), saved.maxCapacity(),
                saved.shared(), resize.added().size());
        return saved;
    }

    @Override
    @Transactional
    public DiningTable updateTable(UpdateTableCommand command) {
        DiningTable current = lockTable(command.tableId());

        if (!current.tableNumber().equals(command.tableNumber())
                && tableRepository.existsByTableNumberExcluding(command.tableNumber(), current.id())) {
            throw new DuplicateTableNumberException(command.tableNumber());
        }
        requireBookingsFit(current, command);

        DiningTable updated = saveUnique(current.update(
                command.tableNumber(),
                command.minCapacity(),
                command.maxCapacity(),
                command.shared(),
                command.location()));

        ChairResize resize = ChairResize.of(
                updated.id(), chairRepository.findByTableId(updated.id()), updated.maxCapacity());
        if (!resize.removed().isEmpty()) {
            chairRepository.deleteAll(resize.removed());
        }
        if (!resize.added().isEmpty()) {
            chairRepository.saveAll(resize.added());
        }

        log.info("Table updated: tableId={}, tableNumber={}, capacity={}-{}, chairsAdded={}, chairsRemoved={}",
                updated.id(), updated.tableNumber(), updated.minCapacity(), updated.maxCapacity(),
                resize.added().size(), resize.removed().size());
        return updated;
    }

    @Override
    @Transactional
    public void deleteTable(UUID tableId) {
        // 락을 먼저 잡아 삭제 도중 새 예약이 배정되지 않도록 한다
        lockTable(tableId);

        if (tableUsageRepository.hasInProgressReservation(tableId)) {
            log.warn("Table deletion rejected, in-progress reservations exist: tableId={}", tableId);
            throw new TableInUseException(tableId);
        }

        tableUsageRepository.deleteAssignmentsByTableId(tableId);
        chairRepository.deleteByTableId(tableId);
        tableRepository.deleteById(tableId);

        log.info("Table deleted: tableId={}", tableId);
    }

    @Override
    @Transactional(readOnly = true)
    public DiningTable getTable(UUID tableId) {
        log.debug("Getting table: tableId={}", tableId);
        return tableRepository.findById(tableId)
                .orElseThrow(() -> new TableNotFoundException(tableId));
    }

    @Override
    @Transactional(readOnly = true)
    public List<DiningTable> getTables(TableFilter filter) {
        log.debug("Getting tables: filter={}", filter);
        return tableRepository.findAll(filter);
    }

    private DiningTable lockTable(UUID tableId) {
        return tableRepository.findAllByIdForUpdate(List.of(tableId)).stream()
                .findFirst()
                .orElseThrow(() -> new TableNotFoundException(tableId));
    }

    /**
     * 최대 인원을 줄이거나 공유를 해제할 때 오늘 이후 예약이 새 설정 안에 들어오는지 확인.
     * 테이블 행 락을 잡은 뒤 호출하므로 확인 중에 새 배정이 끼어들지 않는다.
     */
    private void requireBookingsFit(DiningTable current, UpdateTableCommand command) {
        boolean shrinking = command.maxCapacity() < current.maxCapacity();
        boolean unsharing = current.shared() && !command.shared();
        if (!shrinking && !unsharing) {
            return;
        }

        TableSchedule schedule = new TableSchedule(
                tableUsageRepository.findOccupyingFrom(current.id(), LocalDate.now()));
        String conflict = schedule.conflictWith(command.maxCapacity(), command.shared());
        if (conflict != null) {
            log.warn("Table update rejected: tableId={}, reason={}", current.id(), conflict);
            throw new TableInUseException(current.id(), conflict);
        }
    }

    private DiningTable saveUnique(DiningTable table) {
        try {
            return tableRepository.save(table);
        } catch (DataIntegrityViolationException e) {
            // 동시 생성으로 유니크 인덱스(table_number)에 걸린 경우
            log.warn("Table number collision on save: tableNumber={}", table.tableNumber());
            throw new DuplicateTableNumberException(table.tableNumber());
        }
    }
}
