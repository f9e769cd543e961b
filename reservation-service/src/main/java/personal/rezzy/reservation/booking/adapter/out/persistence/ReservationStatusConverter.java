package personal.rezzy.reservation.booking.adapter.out.persistence;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import personal.rezzy.reservation.booking.domain.model.ReservationStatus;

/**
 * ReservationStatus ↔ 소문자 문자열 (pending, no_show, ...)
 */
@Converter
public class ReservationStatusConverter implements AttributeConverter<ReservationStatus, String> {

    @Override
    public String convertToDatabaseColumn(ReservationStatus status) {
        return status == null ? null : status.value();
    }

    @Override
    public ReservationStatus convertToEntityAttribute(String value) {
        return value == null ? null : ReservationStatus.from(value);
    }
}
