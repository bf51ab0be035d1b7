package com.zerotrust.access.persistence.repository;

import com.zerotrust.access.persistence.entity.DeviceEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface DeviceRepository extends JpaRepository<DeviceEntity, String> {

    Optional<DeviceEntity> findByUserIdAndFingerprint(String userId, String fingerprint);

    @Query("SELECT DISTINCT d.lastSeenLocation FROM DeviceEntity d WHERE d.userId = :userId AND d.lastSeenLocation IS NOT NULL")
    List<String> findDistinctLocationsByUserId(@Param("userId") String userId);
}
