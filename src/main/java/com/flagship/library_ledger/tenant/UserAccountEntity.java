package com.flagship.library_ledger.tenant;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * JPA entity for the {@code users} table.
 *
 * No setters: accounts are created through {@link #create} and otherwise
 * only deleted.
 */
@Entity
@Table(
    name = "users",
    uniqueConstraints = @UniqueConstraint(name = "uq_users_school_username", columnNames = {"school_id", "username"})
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class UserAccountEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "school_id", nullable = false, updatable = false)
    private long schoolId;

    @Column(nullable = false, updatable = false)
    private String username;

    @Column(nullable = false)
    private String password;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private UserRole role;

    public static UserAccountEntity create(long schoolId, String username, String password, UserRole role) {
        return new UserAccountEntity(null, schoolId, username, password, role);
    }

    public UserAccount toDomain() {
        return new UserAccount(id, schoolId, username, role);
    }
}
