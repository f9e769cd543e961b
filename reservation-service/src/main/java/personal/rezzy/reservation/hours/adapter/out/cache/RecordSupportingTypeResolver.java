package personal.rezzy.reservation.hours.adapter.out.cache;

import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.jsontype.PolymorphicTypeValidator;

/**
 * Record 타입 지원 TypeResolver
 *
 * record는 final 클래스라 NON_FINAL 기본 타이핑에서 타입 정보가 빠진다.
 * 캐시 값(EffectiveHours 등)을 원래 타입으로 복원하기 위해 record에는 항상 @class를 붙인다.
 * <p>
 * 허용 패키지 검증은 PolymorphicTypeValidator가 담당한다.
 */
public class RecordSupportingTypeResolver extends ObjectMapper.DefaultTypeResolverBuilder {

    public RecordSupportingTypeResolver(ObjectMapper.DefaultTyping defaultTyping,
                                        PolymorphicTypeValidator polymorphicTypeValidator) {
        super(defaultTyping, polymorphicTypeValidator);
        init(JsonTypeInfo.Id.CLASS, null);
        inclusion(JsonTypeInfo.As.PROPERTY);
    }

    @Override
    public boolean useForType(JavaType t) {
        if (t.getRawClass().isRecord()) {
            return true;
        }
        return super.useForType(t);
    }
}
