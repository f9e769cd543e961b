package personal.rezzy.reservation.table.domain.model;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;

/**
 * 의자 수를 목표 수용 인원에 맞추기 위한 변경 계획
 * 줄일 때는 오래된 의자를 남기고 뒤쪽부터 제거한다.
 *
 * @param added   새로 만들 의자
 * @param removed 제거할 의자
 */
public record ChairResize(List<Chair> added, List<Chair> removed) {

    public static ChairResize of(UUID tableId, List<Chair> current, int targetCount) {
        List<Chair> ordered = current.stream()
                .sorted(Comparator.comparingInt(Chair::position))
                .toList();

        if (ordered.size() > targetCount) {
            return new ChairResize(List.of(), ordered.subList(targetCount, ordered.size()));
        }

        int nextPosition = ordered.isEmpty() ? 1 : ordered.get(ordered.size() - 1).position() + 1;
        List<Chair> added = new ArrayList<>();
        for (int i = ordered.size(); i < targetCount; i++) {
            added.add(Chair.create(tableId, nextPosition++));
        }
        return new ChairResize(List.copyOf(added), List.of());
    }

    public boolean isEmpty() {
        return added.isEmpty() && removed.isEmpty();
    }
}
