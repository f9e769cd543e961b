package personal.rezzy.reservation.booking.integration;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.testcontainers.service.connection.ServiceConnection;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.containers.MySQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;
import personal.rezzy.common.health.HealthCheckService;
import personal.rezzy.reservation.acceptance.support.ReservationTestAdapter;
import personal.rezzy.reservation.booking.application.port.in.BookReservationCommand;
import personal.rezzy.reservation.booking.application.port.in.BookReservationUseCase;
import personal.rezzy.reservation.booking.domain.exception.TableNotAvailableException;
import personal.rezzy.reservation.booking.domain.model.ReservationDetails;
import personal.rezzy.reservation.booking.domain.model.ReservationStatus;
import personal.rezzy.reservation.customer.domain.model.ContactInfo;
import personal.rezzy.reservation.hours.application.port.in.GetOperatingHoursUseCase;
import personal.rezzy.reservation.hours.application.port.in.ManageOperatingHoursUseCase;
import personal.rezzy.reservation.hours.application.port.in.SetOperatingHoursCommand;
import personal.rezzy.reservation.hours.application.port.in.SetSpecialHoursCommand;
import personal.rezzy.reservation.table.application.port.in.CreateTableCommand;
import personal.rezzy.reservation.table.application.port.in.ManageTableUseCase;
import personal.rezzy.reservation.table.domain.model.DiningTable;

import javax.sql.DataSource;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * MySQL + Redis 통합 테스트
 * 운영과 같은 저장소에서 행 잠금과 영업시간 캐시 무효화를 확인한다.
 * Docker가 없으면 건너뛴다.
 */
@Testcontainers(disabledWithoutDocker = true)
@SpringBootTest(properties = "spring.jpa.hibernate.ddl-auto=create-drop")
@DisplayName("MySQL 예약 통합 테스트")
class MySqlBookingIntegrationTest {

    private static final LocalDate DATE = LocalDate.of(2030, 5, 10);

    @Container
    @ServiceConnection
    static MySQLContainer<?> mysql = new MySQLContainer<>(DockerImageName.parse("mysql:8.0.36"))
            .withDatabaseName("rezzy")
            .withUsername("rezzy")
            .withPassword("rezzy");

    @Container
    @ServiceConnection(name = "redis")
    static GenericContainer<?> redis = new GenericContainer<>(DockerImageName.parse("redis:7.2-alpine"))
            .withExposedPorts(6379);

    @Autowired
    private BookReservationUseCase bookReservationUseCase;

    @Autowired
    private ManageTableUseCase manageTableUseCase;

    @Autowired
    private ManageOperatingHoursUseCase manageOperatingHoursUseCase;

    @Autowired
    private GetOperatingHoursUseCase getOperatingHoursUseCase;

    @Autowired
    private HealthCheckService healthCheckService;

    @Autowired
    private DataSource dataSource;

    @Autowired
    private ReservationTestAdapter testAdapter;

    private DiningTable table;

    @BeforeEach
    void setUp() {
        testAdapter.clearAllData();
        for (int day = 0; day <= 6; day++) {
            manageOperatingHoursUseCase.setWeeklyHours(new SetOperatingHoursCommand(
                    day, LocalTime.of(11, 0), LocalTime.of(22, 0), LocalTime.of(21, 0)));
        }
        table = manageTableUseCase.createTable(new CreateTableCommand("T1", 2, 4, false, "window"));
    }

    @AfterEach
    void tearDown() {
        testAdapter.clearAllData();
    }

    @Test
    @DisplayName("데이터베이스와 Redis가 모두 UP이다")
    void componentsAreUp() {
        assertThat(healthCheckService.checkDatabase(dataSource)).isEqualTo("UP");
        assertThat(healthCheckService.checkRedis()).isEqualTo("UP");
    }

    @Test
    @DisplayName("겹치는 시간의 같은 테이블 예약은 거부된다")
    void overlappingBookingRejected() {
        // given
        ReservationDetails first = bookReservationUseCase.book(command("jane@example.com", LocalTime.of(18, 0)));

        // when & then
        assertThat(first.reservation().status()).isEqualTo(ReservationStatus.PENDING);
        assertThatThrownBy(() -> bookReservationUseCase.book(command("john@example.com", LocalTime.of(19, 0))))
                .isInstanceOf(TableNotAvailableException.class);
        assertThat(bookReservationUseCase.book(command("john@example.com", LocalTime.of(19, 30)))
                .reservation().status()).isEqualTo(ReservationStatus.PENDING);
    }

    @Test
    @DisplayName("특별 휴무일 등록 후 캐시된 영업시간이 바로 바뀐다")
    void specialHoursEvictCachedHours() {
        // given
        assertThat(getOperatingHoursUseCase.getEffectiveHours(DATE).open()).isTrue();

        // when
        manageOperatingHoursUseCase.setSpecialHours(new SetSpecialHoursCommand(
                DATE, "Private event", null, true, null, null, null));

        // then
        assertThat(getOperatingHoursUseCase.getEffectiveHours(DATE).open()).isFalse();
    }

    private BookReservationCommand command(String email, LocalTime startTime) {
        return new BookReservationCommand(new ContactInfo("Guest", email, null, null),
                2, DATE, startTime, 90, null, null, List.of(table.id()));
    }
}
