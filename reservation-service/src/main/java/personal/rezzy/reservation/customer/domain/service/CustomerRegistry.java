package personal.rezzy.reservation.customer.domain.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.rezzy.reservation.customer.application.port.out.CustomerRepository;
import personal.rezzy.reservation.customer.domain.model.ContactInfo;
import personal.rezzy.reservation.customer.domain.model.Customer;

import java.util.Optional;

/**
 * Customer Registry (Domain Service)
 * 이메일 → 전화번호 순으로 기존 고객을 찾고, 없으면 새로 등록한다.
 * 호출자의 트랜잭션 안에서 실행된다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CustomerRegistry {

    private final CustomerRepository customerRepository;

    public Customer findOrRegister(ContactInfo contact) {
        Optional<Customer> existing = Optional.empty();
        if (contact.email() != null) {
            existing = customerRepository.findByEmail(contact.email());
        }
        if (existing.isEmpty() && contact.phone() != null) {
            existing = customerRepository.findByPhone(contact.phone());
        }

        if (existing.isPresent()) {
            log.debug("Existing customer matched: customerId={}", existing.get().id());
            return existing.get();
        }

        Customer registered = customerRepository.save(Customer.register(contact));
        log.info("Customer registered: customerId={}", registered.id());
        return registered;
    }
}
