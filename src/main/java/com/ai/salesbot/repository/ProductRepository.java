package com.ai.salesbot.repository;

import com.ai.salesbot.entity.Product;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public interface ProductRepository extends JpaRepository<Product, Long> {

    Optional<Product> findFirstByActiveTrueOrderByUpdatedAtDesc();

    List<Product> findByActiveTrue();

    /**
     * Flips every row in one statement so no reader ever sees zero or two active products.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Product p SET p.active = CASE WHEN p.id = :id THEN true ELSE false END, p.updatedAt = :now "
            + "WHERE p.active = true OR p.id = :id")
    int activateExclusively(@Param("id") Long id, @Param("now") Instant now);
}
