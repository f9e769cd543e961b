package personal.rezzy.reservation.table.adapter.in.web;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import personal.rezzy.reservation.table.application.port.in.CreateTableCommand;
import personal.rezzy.reservation.table.application.port.in.GetTableUseCase;
import personal.rezzy.reservation.table.application.port.in.ManageTableUseCase;
import personal.rezzy.reservation.table.domain.exception.DuplicateTableNumberException;
import personal.rezzy.reservation.table.domain.exception.TableInUseException;
import personal.rezzy.reservation.table.domain.model.DiningTable;
import personal.rezzy.reservation.table.domain.model.TableFilter;

import java.util.List;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.willThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(TableController.class)
@DisplayName("Table API 단위 테스트")
class TableControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ManageTableUseCase manageTableUseCase;

    @MockBean
    private GetTableUseCase getTableUseCase;

    @Test
    @DisplayName("테이블 생성 시 201과 생성된 테이블을 반환한다")
    void createTable() throws Exception {
        // given
        DiningTable table = DiningTable.create("T1", 2, 4, true, "patio");
        given(manageTableUseCase.createTable(any(CreateTableCommand.class))).willReturn(table);

        // when & then
        mockMvc.perform(post("/api/v1/tables")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"tableNumber": "T1", "minCapacity": 2, "maxCapacity": 4, "shared": true, "location": "patio"}
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value(table.id().toString()))
                .andExpect(jsonPath("$.shared").value(true))
                .andExpect(jsonPath("$.maxCapacity").value(4));
    }

    @Test
    @DisplayName("테이블 번호가 10자를 넘으면 400을 반환한다")
    void tableNumberTooLong() throws Exception {
        mockMvc.perform(post("/api/v1/tables")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"tableNumber": "TABLE-00001", "minCapacity": 2, "maxCapacity": 4}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("C001"));

        verifyNoInteractions(manageTableUseCase);
    }

    @Test
    @DisplayName("최대 인원이 최소 인원보다 작으면 400을 반환한다")
    void capacityRangeInvalid() throws Exception {
        mockMvc.perform(post("/api/v1/tables")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"tableNumber": "T1", "minCapacity": 4, "maxCapacity": 2}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("C001"));
    }

    @Test
    @DisplayName("중복된 테이블 번호는 409를 반환한다")
    void duplicateTableNumber() throws Exception {
        // given
        given(manageTableUseCase.createTable(any(CreateTableCommand.class)))
                .willThrow(new DuplicateTableNumberException("T1"));

        // when & then
        mockMvc.perform(post("/api/v1/tables")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"tableNumber": "T1", "minCapacity": 2, "maxCapacity": 4}
                                """))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("T002"))
                .andExpect(jsonPath("$.kind").value("CONFLICT"));
    }

    @Test
    @DisplayName("조회 조건은 TableFilter로 전달된다")
    void getTablesWithFilter() throws Exception {
        // given
        given(getTableUseCase.getTables(any(TableFilter.class)))
                .willReturn(List.of(DiningTable.create("S1", 2, 8, true, null)));

        // when & then
        mockMvc.perform(get("/api/v1/tables")
                        .param("minCapacity", "2")
                        .param("shared", "true"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].tableNumber").value("S1"));

        verify(getTableUseCase).getTables(argThat(filter ->
                Integer.valueOf(2).equals(filter.minCapacity()) && Boolean.TRUE.equals(filter.shared())));
    }

    @Test
    @DisplayName("진행 중인 예약이 있는 테이블 삭제는 409를 반환한다")
    void deleteTableInUse() throws Exception {
        // given
        UUID tableId = UUID.randomUUID();
        willThrow(new TableInUseException(tableId)).given(manageTableUseCase).deleteTable(tableId);

        // when & then
        mockMvc.perform(delete("/api/v1/tables/{tableId}", tableId))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("T003"));
    }

    @Test
    @DisplayName("잘못된 UUID 경로 변수는 400을 반환한다")
    void invalidTableId() throws Exception {
        mockMvc.perform(get("/api/v1/tables/{tableId}", "not-a-uuid"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("C001"));
    }
}
