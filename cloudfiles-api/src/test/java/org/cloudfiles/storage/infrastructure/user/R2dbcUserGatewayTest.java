package org.cloudfiles.storage.infrastructure.user;

import org.cloudfiles.storage.domain.User;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class R2dbcUserGatewayTest {

    @Mock
    private UserRepository userRepository;

    @InjectMocks
    private R2dbcUserGateway gateway;

    @Test
    void getById_mapsEntityToUser() {
        UUID id = UUID.randomUUID();
        UserEntity entity = UserEntity.builder().id(id).login("alice").hashedPassword("hash").build();
        when(userRepository.findById(id)).thenReturn(Mono.just(entity));

        StepVerifier.create(gateway.getById(id))
                .assertNext(user -> {
                    assertEquals(id, user.getId());
                    assertEquals("alice", user.getLogin());
                    assertEquals("hash", user.getHashedPassword());
                })
                .verifyComplete();
    }

    @Test
    void getByLogin_unknown_completesEmpty() {
        when(userRepository.findByLogin("ghost")).thenReturn(Mono.empty());

        StepVerifier.create(gateway.getByLogin("ghost"))
                .verifyComplete();
    }

    @Test
    void save_insertsNewEntity() {
        User user = User.create("alice", "hash");
        when(userRepository.save(any(UserEntity.class))).thenAnswer(invocation -> Mono.just(invocation.getArgument(0)));

        StepVerifier.create(gateway.save(user))
                .verifyComplete();

        ArgumentCaptor<UserEntity> captor = ArgumentCaptor.forClass(UserEntity.class);
        verify(userRepository).save(captor.capture());
        assertTrue(captor.getValue().isNew());
        assertEquals(user.getId(), captor.getValue().getId());
        assertEquals("hash", captor.getValue().getHashedPassword());
    }

    @Test
    void loadedEntity_isNotNew() {
        assertFalse(new UserEntity().isNew());
    }
}
