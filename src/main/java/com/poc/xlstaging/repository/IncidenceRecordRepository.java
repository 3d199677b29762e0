package com.poc.xlstaging.repository;

import com.poc.xlstaging.entity.IncidenceRecord;
import org.springframework.data.jpa.repository.JpaRepository;

public interface IncidenceRecordRepository extends JpaRepository<IncidenceRecord, Long> {
}
