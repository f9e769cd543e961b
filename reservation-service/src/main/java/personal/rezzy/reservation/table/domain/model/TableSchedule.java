package personal.rezzy.reservation.table.domain.model;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Table Schedule
 * 한 테이블에 걸린 예약들의 동시 점유 현황.
 * 테이블 설정(최대 인원, 공유 여부)을 바꾸기 전에 기존 예약이 새 설정을 넘지 않는지 확인한다.
 * <p>
 * 시간대는 반열린 구간이므로 같은 시각에 끝나는 예약과 시작하는 예약은 겹치지 않는다.
 */
public record TableSchedule(List<TableUsage> usages) {

    public TableSchedule {
        usages = List.copyOf(usages);
    }

    /**
     * 어느 시점이든 동시에 앉아 있는 인원 합의 최댓값
     */
    public int peakPartySize() {
        return peak(true);
    }

    /**
     * 어느 시점이든 동시에 걸린 예약 수의 최댓값
     */
    public int peakReservationCount() {
        return peak(false);
    }

    public boolean hasOverlappingUsages() {
        return peakReservationCount() > 1;
    }

    /**
     * 새 설정으로 바꿨을 때 기존 예약이 깨지는지 확인
     *
     * @return 위반 사유, 문제가 없으면 null
     */
    public String conflictWith(int newMaxCapacity, boolean newShared) {
        if (!newShared && hasOverlappingUsages()) {
            return "overlapping reservations exist, table cannot be made non-shared";
        }
        int peak = peakPartySize();
        if (peak > newMaxCapacity) {
            return String.format("booked occupancy %d exceeds new max_capacity %d", peak, newMaxCapacity);
        }
        return null;
    }

    private int peak(boolean weighByPartySize) {
        List<Event> events = new ArrayList<>();
        for (TableUsage usage : usages) {
            int weight = weighByPartySize ? usage.partySize() : 1;
            events.add(new Event(usage.start(), weight));
            events.add(new Event(usage.end(), -weight));
        }
        // 같은 시각이면 종료(음수)를 먼저 처리
        events.sort(Comparator.comparing(Event::at).thenComparingInt(Event::delta));

        int current = 0;
        int peak = 0;
        for (Event event : events) {
            current += event.delta();
            peak = Math.max(peak, current);
        }
        return peak;
    }

    private record Event(LocalDateTime at, int delta) {
    }
}
