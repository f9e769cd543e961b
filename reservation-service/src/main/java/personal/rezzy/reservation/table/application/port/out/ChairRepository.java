package personal.rezzy.reservation.table.application.port.out;

import personal.rezzy.reservation.table.domain.model.Chair;

import java.util.List;
import java.util.UUID;

/**
 * Chair Repository (Output Port)
 */
public interface ChairRepository {

    /**
     * 테이블의 의자 목록 (position 오름차순 = 오래된 순)
     */
    List<Chair> findByTableId(UUID tableId);

    void saveAll(List<Chair> chairs);

    void deleteAll(List<Chair> chairs);

    void deleteByTableId(UUID tableId);
}
