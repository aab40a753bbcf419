package com.ai.salesbot.repository;

import com.ai.salesbot.entity.SystemConfig;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface SystemConfigRepository extends JpaRepository<SystemConfig, Long> {

    Optional<SystemConfig> findByNameAndActiveTrue(String name);

    Optional<SystemConfig> findByName(String name);

    List<SystemConfig> findByActiveTrueOrderByCategoryAscNameAsc();

    List<SystemConfig> findByCategoryAndActiveTrueOrderByNameAsc(String category);
}
