package personal.rezzy.reservation.customer.adapter.out.persistence;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import personal.rezzy.reservation.customer.application.port.out.CustomerRepository;
import personal.rezzy.reservation.customer.domain.model.Customer;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Customer Persistence Adapter
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CustomerPersistenceAdapter implements CustomerRepository {

    private final JpaCustomerRepository jpaCustomerRepository;

    @Override
    public Optional<Customer> findById(UUID customerId) {
        return jpaCustomerRepository.findById(customerId)
                .map(CustomerEntity::toDomain);
    }

    @Override
    public List<Customer> findAllById(Collection<UUID> customerIds) {
        return jpaCustomerRepository.findAllById(customerIds).stream()
                .map(CustomerEntity::toDomain)
                .toList();
    }

    @Override
    public Optional<Customer> findByEmail(String email) {
        return jpaCustomerRepository.findByEmail(email)
                .map(CustomerEntity::toDomain);
    }

    @Override
    public Optional<Customer> findByPhone(String phone) {
        return jpaCustomerRepository.findByPhone(phone)
                .map(CustomerEntity::toDomain);
    }

    @Override
    public Customer save(Customer customer) {
        log.debug("Saving customer: customerId={}", customer.id());
        return jpaCustomerRepository.saveAndFlush(CustomerEntity.fromDomain(customer))
                .toDomain();
    }
}
