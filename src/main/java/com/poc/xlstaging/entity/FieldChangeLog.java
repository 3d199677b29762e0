package com.poc.xlstaging.entity;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;
import java.time.LocalDateTime;

/**
 * One changed field of an incidence record.
 */
@Entity
@Table(name = "portal_updates")
@Data
@NoArgsConstructor
public class FieldChangeLog {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "id_incidence", nullable = false)
    private Long idIncidence;

    @Column(nullable = false)
    private String fieldName;

    @Column(length = 4000)
    private String oldValue;

    @Column(length = 4000)
    private String newValue;

    private String comment;

    @Column(nullable = false, updatable = false)
    private LocalDateTime timestamp;

    public FieldChangeLog(Long idIncidence, String fieldName, String oldValue, String newValue, String comment) {
        this.idIncidence = idIncidence;
        this.fieldName = fieldName;
        this.oldValue = oldValue;
        this.newValue = newValue;
        this.comment = comment;
    }

    @PrePersist
    protected void onCreate() {
        timestamp = LocalDateTime.now();
    }
}
