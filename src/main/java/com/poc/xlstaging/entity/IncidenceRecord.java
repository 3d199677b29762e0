package com.poc.xlstaging.entity;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;
import java.time.LocalDateTime;

@Entity
@Table(name = "incidences")
@Data
@NoArgsConstructor
public class IncidenceRecord {

    @Id
    @Column(name = "id_incidence")
    private Long idIncidence;

    private String sector;

    // Field name to value map as a JSON object
    @Column(name = "misc_json", nullable = false, length = 100000)
    private String miscJson;

    @Column(nullable = false, updatable = false)
    private LocalDateTime createdAt;

    private LocalDateTime updatedAt;

    public IncidenceRecord(Long idIncidence) {
        this.idIncidence = idIncidence;
    }

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
        updatedAt = LocalDateTime.now();
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }
}
