package com.eyelevel.lotprocessor.repository;

import com.eyelevel.lotprocessor.model.BatchLot;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

@Repository
public interface BatchLotRepository extends JpaRepository<BatchLot, Long> {

    List<BatchLot> findByJobIdOrderByPositionAsc(UUID jobId);

    @Modifying
    @Query("DELETE FROM BatchLot l WHERE l.job.id IN :jobIds")
    int deleteByJobIds(@Param("jobIds") Collection<UUID> jobIds);
}
