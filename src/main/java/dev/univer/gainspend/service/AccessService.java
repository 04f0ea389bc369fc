package dev.univer.gainspend.service;

import dev.univer.gainspend.model.AllowedUser;
import dev.univer.gainspend.repo.AllowedUserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Service
@RequiredArgsConstructor
@Slf4j
public class AccessService {
    private final AllowedUserRepository allowedUserRepository;
    private final TelegramProperties props;
    private final Clock clock;

    static final int MAX_REMEMBERED_REQUESTS = 256;

    // последние запросы доступа: при /grant подставим имя и username; самые старые вытесняются
    private final Map<Long, AccessRequest> lastRequests = Collections.synchronizedMap(
            new LinkedHashMap<Long, AccessRequest>(16, 0.75f, true) {
                @Override
                protected boolean removeEldestEntry(Map.Entry<Long, AccessRequest> eldest) {
                    return size() > MAX_REMEMBERED_REQUESTS;
                }
            });

    public boolean isAllowed(Long userId) {
        if (!props.isAccessControl()) return true;
        if (userId == null) return false;
        return props.isOwner(userId) || allowedUserRepository.existsByUserId(userId);
    }

    public void rememberRequest(AccessRequest request) {
        lastRequests.put(request.userId(), request);
    }

    @Transactional
    public AllowedUser grant(Long userId) {
        AccessRequest known = lastRequests.remove(userId);
        AllowedUser user = allowedUserRepository.findByUserId(userId)
                .orElseGet(() -> AllowedUser.builder()
                        .userId(userId)
                        .createdAt(LocalDateTime.now(clock))
                        .build());
        if (known != null) {
            user.setUsername(known.username());
            user.setFirstName(known.firstName());
        }
        AllowedUser saved = allowedUserRepository.save(user);
        log.info("Access granted to user {}", userId);
        return saved;
    }

    @Transactional
    public boolean revoke(Long userId) {
        lastRequests.remove(userId);
        Optional<AllowedUser> existing = allowedUserRepository.findByUserId(userId);
        if (existing.isEmpty()) return false;
        allowedUserRepository.delete(existing.get());
        log.info("Access revoked from user {}", userId);
        return true;
    }

    int rememberedRequests() {
        return lastRequests.size();
    }

    public List<AllowedUser> listAllowed() {
        return allowedUserRepository.findAllByOrderByCreatedAtAsc();
    }
}
