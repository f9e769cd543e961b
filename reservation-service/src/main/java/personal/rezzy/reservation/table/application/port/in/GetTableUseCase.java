package personal.rezzy.reservation.table.application.port.in;

import personal.rezzy.reservation.table.domain.model.DiningTable;
import personal.rezzy.reservation.table.domain.model.TableFilter;

import java.util.List;
import java.util.UUID;

/**
 * Get Table UseCase (Input Port)
 */
public interface GetTableUseCase {

    DiningTable getTable(UUID tableId);

    List<DiningTable> getTables(TableFilter filter);
}
