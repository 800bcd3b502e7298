package com.github.dimitryivaniuta.paydispatch.repo;

import com.github.dimitryivaniuta.paydispatch.domain.Payment;
import java.util.List;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

/**
 * JPA repository for {@link Payment}.
 */
public interface PaymentRepository extends JpaRepository<Payment, Long> {

    /**
     * Payment history of a user, newest first.
     *
     * @param userId user id
     * @return payments
     */
    @Query("select p from Payment p where p.userId = :userId order by p.createdAt desc, p.id desc")
    List<Payment> findHistory(@Param("userId") Long userId);

    /**
     * Latest payments across all users, newest first. The page size bounds the result.
     *
     * @param page page request
     * @return payments
     */
    @Query("select p from Payment p order by p.createdAt desc, p.id desc")
    List<Payment> findLatest(Pageable page);
}
