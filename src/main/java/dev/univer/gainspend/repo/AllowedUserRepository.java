package dev.univer.gainspend.repo;

import dev.univer.gainspend.model.AllowedUser;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface AllowedUserRepository extends JpaRepository<AllowedUser, Long> {
    Optional<AllowedUser> findByUserId(Long userId);
    boolean existsByUserId(Long userId);
    List<AllowedUser> findAllByOrderByCreatedAtAsc();
}
