package org.cloudfiles.storage.infrastructure.user;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.cloudfiles.storage.domain.User;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Transient;
import org.springframework.data.domain.Persistable;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Table("users")
public class UserEntity implements Persistable<UUID> {

    @Id
    @Column("id")
    private UUID id;

    @Column("login")
    private String login;

    @Column("hashed_password")
    private String hashedPassword;

    // ids are generated by the domain, so inserts must be forced
    @Transient
    @Builder.Default
    private boolean newEntity = false;

    public static UserEntity newUser(User user) {
        return UserEntity.builder()
                .id(user.getId())
                .login(user.getLogin())
                .hashedPassword(user.getHashedPassword())
                .newEntity(true)
                .build();
    }

    public User toUser() {
        return User.restore(id, login, hashedPassword);
    }

    @Override
    public boolean isNew() {
        return newEntity;
    }
}
