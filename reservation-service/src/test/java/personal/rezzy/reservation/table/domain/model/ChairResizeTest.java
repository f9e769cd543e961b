package personal.rezzy.reservation.table.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ChairResize 단위 테스트")
class ChairResizeTest {

    private final UUID tableId = UUID.randomUUID();

    @Test
    @DisplayName("새 테이블은 최대 수용 인원만큼 의자를 만든다")
    void create() {
        ChairResize resize = ChairResize.of(tableId, List.of(), 4);

        assertThat(resize.added()).extracting(Chair::position).containsExactly(1, 2, 3, 4);
        assertThat(resize.removed()).isEmpty();
    }

    @Test
    @DisplayName("4 → 2 → 6으로 바꾸면 오래된 의자를 남기고 이어서 번호를 붙인다")
    void shrinkThenGrow() {
        // given
        List<Chair> chairs = new ArrayList<>(ChairResize.of(tableId, List.of(), 4).added());

        // when: 4 → 2
        ChairResize shrink = ChairResize.of(tableId, chairs, 2);
        chairs.removeAll(shrink.removed());

        // then
        assertThat(shrink.removed()).extracting(Chair::position).containsExactly(3, 4);
        assertThat(chairs).extracting(Chair::position).containsExactly(1, 2);

        // when: 2 → 6
        ChairResize grow = ChairResize.of(tableId, chairs, 6);

        // then
        assertThat(grow.removed()).isEmpty();
        assertThat(grow.added()).extracting(Chair::position).containsExactly(3, 4, 5, 6);
        assertThat(grow.added()).allMatch(chair -> chair.tableId().equals(tableId) && chair.assigned());
    }

    @Test
    @DisplayName("수용 인원이 같으면 변경이 없다")
    void unchanged() {
        List<Chair> chairs = ChairResize.of(tableId, List.of(), 3).added();

        assertThat(ChairResize.of(tableId, chairs, 3).isEmpty()).isTrue();
    }
}
