package com.habitsnap.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.UUID;

/**
 * Habit metadata, owned by the habits module of the surrounding application.
 *
 * Read-only here: the penalty sweep only needs the owner and whether the
 * habit is active.
 *
 * Database Table: habits
 */
@Entity
@Table(name = "habits", indexes = {
    @Index(name = "idx_habits_user_active", columnList = "user_id, is_active")
})
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Habit {

    @Id
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Column(name = "title", nullable = false, length = 100)
    private String title;

    @Column(name = "is_active", nullable = false)
    private Boolean isActive = true;
}
