package personal.rezzy.reservation.customer.application.port.out;

import personal.rezzy.reservation.customer.domain.model.Customer;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Customer Repository (Output Port)
 */
public interface CustomerRepository {

    Optional<Customer> findById(UUID customerId);

    List<Customer> findAllById(Collection<UUID> customerIds);

    Optional<Customer> findByEmail(String email);

    Optional<Customer> findByPhone(String phone);

    Customer save(Customer customer);
}
