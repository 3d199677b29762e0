package com.poc.xlstaging.repository;

import com.poc.xlstaging.entity.FieldChangeLog;
import org.springframework.data.jpa.repository.JpaRepository;
import java.util.List;

public interface FieldChangeLogRepository extends JpaRepository<FieldChangeLog, Long> {
    List<FieldChangeLog> findByIdIncidenceOrderByIdAsc(Long idIncidence);
}
