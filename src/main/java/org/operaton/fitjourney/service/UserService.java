package org.operaton.fitjourney.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.operaton.fitjourney.exception.RecordNotFoundException;
import org.operaton.fitjourney.exception.ValidationException;
import org.operaton.fitjourney.model.entity.ChangeQueueEntry.SyncOperation;
import org.operaton.fitjourney.model.entity.User;
import org.operaton.fitjourney.repository.UserRepository;
import org.operaton.fitjourney.security.LocalSessionUserProvider;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Service for the locally stored user account.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class UserService {

    private final UserRepository userRepository;
    private final ChangeQueueService changeQueueService;
    private final LocalSessionUserProvider sessionUserProvider;
    private final Clock clock;

    /**
     * Store the user reported by the auth provider and open the local session.
     * Creates the row on first sign-in, refreshes names and height otherwise.
     *
     * @param profile the user as known to the auth provider
     * @return the stored user
     */
    @Transactional
    public User signIn(User profile) {
        validate(profile);
        LocalDateTime now = LocalDateTime.now(clock);

        Optional<User> existing = userRepository.findById(profile.getId());
        User user = existing.orElseGet(() -> User.builder()
                .id(profile.getId())
                .registrationDate(profile.getRegistrationDate() != null ? profile.getRegistrationDate() : now)
                .build());
        user.setFirstName(profile.getFirstName());
        user.setLastName(profile.getLastName());
        user.setHeightCm(profile.getHeightCm());
        user.setLastLogin(now);

        User saved = userRepository.save(user);
        changeQueueService.enqueue(ChangeQueueService.TABLE_USERS, saved.getId(),
                existing.isPresent() ? SyncOperation.UPDATE : SyncOperation.INSERT);
        sessionUserProvider.signIn(saved.getId());

        log.info("User {} signed in ({})", saved.getId(), existing.isPresent() ? "returning" : "new");
        return saved;
    }

    /**
     * Update the last-login timestamp.
     */
    @Transactional
    public void recordLogin(String userId) {
        User user = userRepository.findById(userId)
                .orElseThrow(() -> new RecordNotFoundException("users", userId));
        user.setLastLogin(LocalDateTime.now(clock));
        userRepository.save(user);
        changeQueueService.enqueue(ChangeQueueService.TABLE_USERS, userId, SyncOperation.UPDATE);
    }

    @Transactional
    public User updateProfile(String userId, String firstName, String lastName, Double heightCm) {
        User user = userRepository.findById(userId)
                .orElseThrow(() -> new RecordNotFoundException("users", userId));
        user.setFirstName(firstName);
        user.setLastName(lastName);
        user.setHeightCm(heightCm);
        validate(user);

        User saved = userRepository.save(user);
        changeQueueService.enqueue(ChangeQueueService.TABLE_USERS, userId, SyncOperation.UPDATE);
        return saved;
    }

    @Transactional(readOnly = true)
    public Optional<User> getUser(String userId) {
        return userRepository.findById(userId);
    }

    @Transactional(readOnly = true)
    public List<String> getAllUserIds() {
        return userRepository.findAll().stream().map(User::getId).toList();
    }

    public void signOut() {
        sessionUserProvider.signOut();
    }

    private void validate(User user) {
        if (user.getId() == null || user.getId().isBlank()) {
            throw new ValidationException("User id is required");
        }
        if (user.getFirstName() == null || user.getLastName() == null) {
            throw new ValidationException("First and last name are required");
        }
        if (user.getHeightCm() != null && user.getHeightCm() <= 0) {
            throw new ValidationException("Height must be positive");
        }
    }
}
