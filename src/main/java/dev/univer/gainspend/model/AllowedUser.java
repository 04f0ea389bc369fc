package dev.univer.gainspend.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

@Entity
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
@Table(name = "allowed_users", uniqueConstraints = @UniqueConstraint(columnNames = {"userId"}))
public class AllowedUser {
    @Id @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private Long userId;

    private String username;
    private String firstName;

    private LocalDateTime createdAt;
}
