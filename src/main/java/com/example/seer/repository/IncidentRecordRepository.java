package com.example.seer.repository;

import com.example.seer.domain.IncidentRecord;
import com.example.seer.domain.IncidentStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface IncidentRecordRepository extends JpaRepository<IncidentRecord, String> {

    @Query("SELECT i.id FROM IncidentRecord i WHERE i.id LIKE 'INC-%'")
    List<String> findAllIncidentIds();

    @Query("SELECT i FROM IncidentRecord i ORDER BY i.createdAt DESC")
    List<IncidentRecord> findRecent(Pageable pageable);

    List<IncidentRecord> findByServiceAndStatusIn(String service, List<IncidentStatus> statuses);
}
