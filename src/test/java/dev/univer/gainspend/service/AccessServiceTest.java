package dev.univer.gainspend.service;

import dev.univer.gainspend.model.AllowedUser;
import dev.univer.gainspend.repo.AllowedUserRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AccessServiceTest {

    private static final Long OWNER = 1L;

    @Mock
    private AllowedUserRepository allowedUserRepository;

    private TelegramProperties props;
    private AccessService accessService;

    @BeforeEach
    void setUp() {
        props = new TelegramProperties();
        props.setAccessControl(true);
        props.setOwnerId(OWNER);
        accessService = new AccessService(allowedUserRepository, props,
                Clock.fixed(Instant.parse("2025-11-05T10:00:00Z"), ZoneOffset.UTC));
    }

    @Test
    void owner_isAlwaysAllowedWithoutLookup() {
        assertThat(accessService.isAllowed(OWNER)).isTrue();
        verifyNoInteractions(allowedUserRepository);
    }

    @Test
    void listedUser_isAllowed_othersAreNot() {
        when(allowedUserRepository.existsByUserId(5L)).thenReturn(true);
        when(allowedUserRepository.existsByUserId(6L)).thenReturn(false);

        assertThat(accessService.isAllowed(5L)).isTrue();
        assertThat(accessService.isAllowed(6L)).isFalse();
    }

    @Test
    void disabledAccessControl_allowsEveryone() {
        props.setAccessControl(false);

        assertThat(accessService.isAllowed(999L)).isTrue();
        verifyNoInteractions(allowedUserRepository);
    }

    @Test
    void grant_fillsIdentityFromRememberedRequest() {
        when(allowedUserRepository.findByUserId(5L)).thenReturn(Optional.empty());
        when(allowedUserRepository.save(any(AllowedUser.class))).thenAnswer(inv -> inv.getArgument(0));
        accessService.rememberRequest(new AccessRequest(5L, "anna", "Анна"));

        AllowedUser u = accessService.grant(5L);

        assertThat(u.getUserId()).isEqualTo(5L);
        assertThat(u.getUsername()).isEqualTo("anna");
        assertThat(u.getFirstName()).isEqualTo("Анна");
        assertThat(u.getCreatedAt()).isNotNull();
    }

    @Test
    void grant_existingUser_isUpsert() {
        AllowedUser existing = AllowedUser.builder().id(3L).userId(5L).username("old").build();
        when(allowedUserRepository.findByUserId(5L)).thenReturn(Optional.of(existing));
        when(allowedUserRepository.save(any(AllowedUser.class))).thenAnswer(inv -> inv.getArgument(0));

        AllowedUser u = accessService.grant(5L);

        assertThat(u).isSameAs(existing);
        assertThat(u.getUsername()).isEqualTo("old");
    }

    @Test
    void revoke_deletesOnlyKnownUsers() {
        AllowedUser existing = AllowedUser.builder().id(3L).userId(5L).build();
        when(allowedUserRepository.findByUserId(5L)).thenReturn(Optional.of(existing));
        when(allowedUserRepository.findByUserId(6L)).thenReturn(Optional.empty());

        assertThat(accessService.revoke(5L)).isTrue();
        assertThat(accessService.revoke(6L)).isFalse();
        verify(allowedUserRepository).delete(existing);
    }

    @Test
    void rememberedRequests_areCappedAndDroppedOnRevoke() {
        for (long id = 100; id < 100 + AccessService.MAX_REMEMBERED_REQUESTS + 50; id++) {
            accessService.rememberRequest(new AccessRequest(id, null, null));
        }
        assertThat(accessService.rememberedRequests()).isEqualTo(AccessService.MAX_REMEMBERED_REQUESTS);

        accessService.rememberRequest(new AccessRequest(7L, "ivan", "Иван"));
        when(allowedUserRepository.findByUserId(7L)).thenReturn(Optional.empty());
        accessService.revoke(7L);

        assertThat(accessService.rememberedRequests()).isEqualTo(AccessService.MAX_REMEMBERED_REQUESTS - 1);
    }
}
