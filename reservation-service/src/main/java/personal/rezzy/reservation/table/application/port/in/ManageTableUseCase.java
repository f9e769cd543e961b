package personal.rezzy.reservation.table.application.port.in;

import personal.rezzy.reservation.table.domain.model.DiningTable;

import java.util.UUID;

/**
 * Manage Table UseCase (Input Port)
 * 테이블 생성/수정/삭제. 의자 레코드는 max_capacity와 함께 움직인다.
 */
public interface ManageTableUseCase {

    /**
     * 테이블 생성 후 max_capacity 개수만큼 의자 생성
     *
     * @throws personal.rezzy.reservation.table.domain.exception.DuplicateTableNumberException 테이블 번호 중복
     */
    DiningTable createTable(CreateTableCommand command);

    /**
     * 테이블 전체 수정. 의자는 오래된 것부터 유지하고 초과분은 뒤에서 제거
     *
     * @throws personal.rezzy.reservation.table.domain.exception.TableNotFoundException 테이블 없음
     */
    DiningTable updateTable(UpdateTableCommand command);

    /**
     * 테이블 삭제 (의자, 과거 배정 기록 포함)
     *
     * @throws personal.rezzy.reservation.table.domain.exception.TableInUseException 진행 중인 예약 존재
     */
    void deleteTable(UUID tableId);
}
