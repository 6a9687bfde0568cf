package de.leidenheit.ate.demo.service;

import de.leidenheit.ate.demo.model.UserDto;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * In-memory user store keyed by user id.
 */
@Slf4j
@Service
public class UserService {

    private final Map<Long, UserDto> users = new ConcurrentSkipListMap<>();

    /**
     * @return {@code false} if a user with the id already exists
     */
    public boolean create(final long id, final UserDto user) {
        var created = users.putIfAbsent(id, copy(user)) == null;
        log.info("Create user {}: {}", id, created ? "created" : "already existed");
        return created;
    }

    public Optional<UserDto> find(final long id) {
        return Optional.ofNullable(users.get(id)).map(this::copy);
    }

    public List<UserDto> findAll() {
        return new ArrayList<>(users.values().stream().map(this::copy).toList());
    }

    public boolean update(final long id, final UserDto user) {
        return users.replace(id, copy(user)) != null;
    }

    public boolean delete(final long id) {
        return users.remove(id) != null;
    }

    public void deleteAll() {
        users.clear();
        log.info("Deleted all users");
    }

    private UserDto copy(final UserDto user) {
        return UserDto.builder()
                .name(user.getName())
                .password(user.getPassword())
                .build();
    }
}
