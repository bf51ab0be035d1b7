package com.zerotrust.access.persistence.repository;

import com.zerotrust.access.persistence.entity.PolicyEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface PolicyRepository extends JpaRepository<PolicyEntity, String> {

    List<PolicyEntity> findByEnabledTrue();

    boolean existsByName(String name);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE PolicyEntity p SET p.priority = p.priority + 1 WHERE p.priority >= :priority")
    int shiftPrioritiesFrom(@Param("priority") int priority);
}
